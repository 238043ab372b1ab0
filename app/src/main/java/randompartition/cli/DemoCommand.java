package randompartition.cli;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SplittableRandom;
import randompartition.core.IntegerPartition;
import randompartition.core.RestrictionPolicies;
import randompartition.core.RestrictionPolicy;
import randompartition.format.PartitionFormatter;
import randompartition.sampler.RandomPartitions;
import randompartition.sampler.SamplerOptions;
import randompartition.sampler.SamplingBudgetExceededException;
import randompartition.sampler.SamplingMethod;

/**
 * Walks through every sampling method and the built-in policies for one target size.
 *
 * <p>Usage: {@code demo [--n 100] [--seed 42]}.
 */
final class DemoCommand {
  private static final long DEFAULT_TARGET = 100;
  // Restricted policies may have no partition of the target at all, e.g. even parts of 101.
  private static final SamplerOptions RESTRICTED_BUDGET =
      SamplerOptions.defaults().attempts(100_000);

  private final PrintStream out;

  DemoCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) {
    String[] effectiveArgs =
        args.length > 0 && "demo".equalsIgnoreCase(args[0])
            ? Arrays.copyOfRange(args, 1, args.length)
            : args;
    long target = DEFAULT_TARGET;
    Long seed = null;
    for (int i = 0; i < effectiveArgs.length; i++) {
      switch (effectiveArgs[i]) {
        case "--n" -> target = CliParsers.parseLong(value(effectiveArgs, ++i, "--n"), 0, "--n");
        case "--seed" ->
            seed = CliParsers.parseLong(value(effectiveArgs, ++i, "--seed"), 0, "--seed");
        default -> throw new IllegalArgumentException("Unknown option: " + effectiveArgs[i]);
      }
    }
    SplittableRandom random = seed != null ? new SplittableRandom(seed) : new SplittableRandom();

    RandomPartitions unrestricted = RandomPartitions.of(RestrictionPolicies.unrestricted(), random);
    IntegerPartition partition = unrestricted.sample(target);
    out.println(PartitionFormatter.commaSeparated(partition));
    out.print(PartitionFormatter.ferrers(partition));

    IntegerPartition randomSize = unrestricted.sampleWith(SamplingMethod.EXPECTED_SIZE, target);
    report("Random size", randomSize, target);
    report("Rejection", unrestricted.sampleWith(SamplingMethod.REJECTION, target), target);
    report(
        "PDC deterministic second half",
        unrestricted.sampleWith(SamplingMethod.DETERMINISTIC_SECOND_HALF, target),
        target);
    report("Default", unrestricted.sample(target), target);

    for (Map.Entry<String, RestrictionPolicy> entry : restrictedExamples().entrySet()) {
      String label = "Partition into " + entry.getKey();
      try {
        IntegerPartition restricted =
            RandomPartitions.of(entry.getValue(), random).sample(target, RESTRICTED_BUDGET);
        report(label, restricted, target);
      } catch (SamplingBudgetExceededException ex) {
        out.printf("%s: none found after %d attempts%n", label, ex.attempts());
      }
    }
    return SampleCommand.EXIT_OK;
  }

  private void report(String label, IntegerPartition partition, long target) {
    out.printf(
        "%s: %s%n  has size %d (target %d)%n",
        label, PartitionFormatter.commaSeparated(partition), partition.weight(), target);
  }

  private static Map<String, RestrictionPolicy> restrictedExamples() {
    Map<String, RestrictionPolicy> examples = new LinkedHashMap<>();
    examples.put("even parts", RestrictionPolicies.even());
    examples.put("odd parts", RestrictionPolicies.odd());
    examples.put("cubes", RestrictionPolicies.powers(3));
    examples.put("parts at most 10", RestrictionPolicies.atMost(10));
    examples.put("parts at least 4", RestrictionPolicies.atLeast(4));
    examples.put("parts = 5 mod 7", RestrictionPolicies.residue(5, 7));
    return examples;
  }

  private static String value(String[] args, int index, String option) {
    if (index >= args.length) {
      throw new IllegalArgumentException("Missing value for " + option);
    }
    return args[index];
  }
}
