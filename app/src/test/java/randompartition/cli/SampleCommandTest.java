package randompartition.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import randompartition.sampler.SamplingMethod;

final class SampleCommandTest {
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final SampleCommand command =
      new SampleCommand(new PrintStream(buffer, true, StandardCharsets.UTF_8));

  private String output() {
    return buffer.toString(StandardCharsets.UTF_8);
  }

  @Test
  void parsesEveryOption() {
    CliOptions options =
        command.parseArgs(
            new String[] {
              "sample",
              "--n=64",
              "--policy",
              "residue:1:4",
              "--method",
              "rejection",
              "--seed",
              "5",
              "--tilt",
              "0.9",
              "--max-attempts=200",
              "--strict-tilt",
              "--count",
              "3",
              "--format",
              "json"
            });

    assertEquals(64, options.target());
    assertEquals("residue:1:4", options.policySpec());
    assertEquals(5, options.policy().partSize(2));
    assertEquals(SamplingMethod.REJECTION, options.method());
    assertEquals(5L, options.seed());
    assertEquals(0.9, options.samplerOptions().tiltOverride());
    assertEquals(200, options.samplerOptions().maxAttempts());
    assertTrue(options.samplerOptions().requireConvergedTilt());
    assertEquals(3, options.count());
    assertEquals(CliOptions.OutputFormat.JSON, options.format());
  }

  @Test
  void defaultsApplyWithoutOptions() {
    CliOptions options = command.parseArgs(new String[] {"sample"});
    assertEquals(100, options.target());
    assertEquals(SamplingMethod.recommended(), options.method());
    assertEquals(1, options.count());
    assertNull(options.seed());
  }

  @Test
  void textOutputPrintsOneLinePerSample() {
    int code = command.execute(new String[] {"--n", "30", "--seed", "3", "--count", "4"});

    assertEquals(SampleCommand.EXIT_OK, code);
    String[] lines = output().strip().split("\\R");
    assertEquals(4, lines.length);
    for (String line : lines) {
      long sum = 0;
      for (String part : line.split(",")) {
        sum += Long.parseLong(part);
      }
      assertEquals(30, sum, "line " + line);
    }
  }

  @Test
  void jsonOutputDescribesRun() {
    int code =
        command.execute(
            new String[] {"sample", "--n", "25", "--policy", "odd", "--seed", "11", "--count=2",
              "--format", "json"});
    assertEquals(SampleCommand.EXIT_OK, code);

    JsonObject root = JsonParser.parseString(output()).getAsJsonObject();
    JsonObject meta = root.getAsJsonObject("meta");
    assertEquals(25, meta.get("target").getAsLong());
    assertEquals("odd", meta.get("policy").getAsString());
    assertEquals("deterministic_second_half", meta.get("method").getAsString());
    assertTrue(meta.get("exact").getAsBoolean());
    assertEquals(11, meta.get("seed").getAsLong());
    assertFalse(meta.has("tilt_override"));

    JsonArray samples = root.getAsJsonArray("samples");
    assertEquals(2, samples.size());
    for (JsonElement element : samples) {
      JsonObject sample = element.getAsJsonObject();
      assertEquals(25, sample.get("weight").getAsLong());
      long sum = 0;
      for (JsonElement part : sample.getAsJsonArray("parts")) {
        assertEquals(1, part.getAsLong() % 2, "odd parts only");
        sum += part.getAsLong();
      }
      assertEquals(25, sum);
      assertTrue(sample.get("tilt_converged").getAsBoolean());
    }
  }

  @Test
  void jsonOmitsSolverFieldsWhenTiltOverridden() {
    command.execute(
        new String[] {"--n", "10", "--tilt", "0.6", "--seed", "2", "--format", "json"});

    JsonObject root = JsonParser.parseString(output()).getAsJsonObject();
    assertEquals(0.6, root.getAsJsonObject("meta").get("tilt_override").getAsDouble());
    JsonObject sample = root.getAsJsonArray("samples").get(0).getAsJsonObject();
    assertEquals(0.6, sample.get("tilt").getAsDouble());
    assertFalse(sample.has("tilt_iterations"));
  }

  @Test
  void ferrersFormatDrawsRows() {
    command.execute(new String[] {"--n", "6", "--seed", "1", "--format", "ferrers"});
    long cells = output().chars().filter(c -> c == '*').count();
    assertEquals(6, cells);
  }

  @Test
  void exhaustedBudgetReturnsDedicatedExitCode() {
    int code =
        command.execute(
            new String[] {"--n", "7", "--policy", "even", "--max-attempts", "20", "--seed", "1"});
    assertEquals(SampleCommand.EXIT_BUDGET_EXCEEDED, code);
    assertTrue(output().isEmpty(), "nothing printed on failure");
  }

  @Test
  void rejectsUnknownOptionsAndMissingValues() {
    assertThrows(
        IllegalArgumentException.class, () -> command.parseArgs(new String[] {"--bogus", "1"}));
    assertThrows(IllegalArgumentException.class, () -> command.parseArgs(new String[] {"--n"}));
    assertThrows(
        IllegalArgumentException.class, () -> command.parseArgs(new String[] {"--count", "0"}));
    assertThrows(
        IllegalArgumentException.class, () -> command.parseArgs(new String[] {"--n", "-4"}));
  }
}
