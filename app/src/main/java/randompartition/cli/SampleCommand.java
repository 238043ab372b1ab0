package randompartition.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import randompartition.format.PartitionFormatter;
import randompartition.sampler.RandomPartitions;
import randompartition.sampler.SamplingBudgetExceededException;
import randompartition.sampler.SamplingMethod;
import randompartition.sampler.SamplingResult;

/** Handles the primary {@code sample} command. */
final class SampleCommand {
  private static final Logger LOG = LoggerFactory.getLogger(SampleCommand.class);

  static final int EXIT_OK = 0;
  static final int EXIT_BUDGET_EXCEEDED = 3;

  private final PrintStream out;

  SampleCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) {
    CliOptions options = parseArgs(args);
    SplittableRandom random =
        options.seed() != null ? new SplittableRandom(options.seed()) : new SplittableRandom();
    RandomPartitions partitions = RandomPartitions.of(options.policy(), random);

    List<SamplingResult> results = new ArrayList<>(options.count());
    try {
      for (int i = 0; i < options.count(); i++) {
        results.add(
            partitions.runWith(options.method(), options.target(), options.samplerOptions()));
      }
    } catch (SamplingBudgetExceededException ex) {
      LOG.error("{} (policy {})", ex.getMessage(), options.policySpec());
      return EXIT_BUDGET_EXCEEDED;
    }

    print(options, results);
    return EXIT_OK;
  }

  private void print(CliOptions options, List<SamplingResult> results) {
    switch (options.format()) {
      case JSON -> out.println(new JsonReportBuilder().build(options, results));
      case FERRERS -> {
        for (SamplingResult result : results) {
          out.print(PartitionFormatter.ferrers(result.partition()));
          out.println();
        }
      }
      case TEXT -> {
        for (SamplingResult result : results) {
          out.println(PartitionFormatter.commaSeparated(result.partition()));
          LOG.info(
              "weight={} attempts={} tilt={} ({} ms)",
              result.weight(),
              result.attempts(),
              result.tilt(),
              result.elapsedNanos() / 1_000_000.0);
        }
      }
    }
  }

  CliOptions parseArgs(String[] args) {
    String[] effectiveArgs = stripCommand(args);
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, OptionSpec> specs = optionSpecs();

    for (int i = 0; i < effectiveArgs.length; i++) {
      ParsedArg parsed = ParsedArg.parse(effectiveArgs[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + effectiveArgs[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= effectiveArgs.length) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = effectiveArgs[++i];
      }
      spec.apply(builder, value);
    }

    return builder.build();
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put(
        "--n", OptionSpec.withValue((b, raw) -> b.target(CliParsers.parseLong(raw, 0, "--n"))));
    specs.put("--policy", OptionSpec.withValue((b, raw) -> b.policy(raw)));
    specs.put("--method", OptionSpec.withValue((b, raw) -> b.method(SamplingMethod.parse(raw))));
    specs.put(
        "--seed",
        OptionSpec.withValue((b, raw) -> b.seed(CliParsers.parseLong(raw, 0, "--seed"))));
    specs.put(
        "--tilt", OptionSpec.withValue((b, raw) -> b.tilt(CliParsers.parseDouble(raw, "--tilt"))));
    specs.put(
        "--max-attempts",
        OptionSpec.withValue(
            (b, raw) -> b.maxAttempts(CliParsers.parseLong(raw, 0, "--max-attempts"))));
    specs.put("--strict-tilt", OptionSpec.flag(b -> b.strictTilt(true)));
    specs.put(
        "--count",
        OptionSpec.withValue((b, raw) -> b.count(CliParsers.parseInt(raw, 1, "--count"))));
    specs.put("--format", OptionSpec.withValue((b, raw) -> b.format(CliParsers.parseFormat(raw))));
    return specs;
  }

  private String[] stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if ("sample".equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
