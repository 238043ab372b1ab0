package randompartition.cli;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code Main sample --n 100 [--policy even] [--method dsh] [--seed 7] [--format json]}
 *   <li>{@code Main demo [--n 100] [--seed 7]}
 * </ul>
 *
 * <p>Options without a command run {@code sample}; no arguments at all run the demo.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_USAGE = 1;

  private Main() {}

  public static void main(String[] args) {
    int code = run(args);
    if (code != 0) {
      System.exit(code);
    }
  }

  static int run(String[] args) {
    try {
      if (args == null || args.length == 0) {
        return new DemoCommand(System.out).execute(new String[0]);
      }
      return switch (args[0].toLowerCase(Locale.ROOT)) {
        case "demo" -> new DemoCommand(System.out).execute(args);
        default -> new SampleCommand(System.out).execute(args);
      };
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      LOG.error(
          "Usage: sample --n <int> [--policy <spec>] [--method dsh|rejection|expected] [--seed"
              + " <long>] [--tilt <x>] [--max-attempts <n>] [--strict-tilt] [--count <k>]"
              + " [--format text|ferrers|json] | demo [--n <int>] [--seed <long>]");
      return EXIT_USAGE;
    }
  }
}
