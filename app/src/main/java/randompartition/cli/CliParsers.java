package randompartition.cli;

import com.google.common.base.Splitter;
import java.util.List;
import java.util.Locale;
import randompartition.core.RestrictionPolicies;
import randompartition.core.RestrictionPolicy;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {
  private static final Splitter POLICY_SPLITTER = Splitter.on(':').trimResults();

  private CliParsers() {}

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static long parseLong(String raw, long defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + optionName + ": " + raw);
    }
  }

  static double parseDouble(String raw, String optionName) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Missing value for " + optionName);
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid number for " + optionName + ": " + raw);
    }
  }

  /**
   * Parses a policy spec: {@code unrestricted}, {@code even}, {@code odd}, {@code triangular},
   * {@code residue:J:M}, {@code max:K}, {@code min:K} or {@code powers:K}.
   */
  static RestrictionPolicy parsePolicy(String raw) {
    if (raw == null || raw.isBlank()) {
      return RestrictionPolicies.unrestricted();
    }
    List<String> tokens = POLICY_SPLITTER.splitToList(raw.toLowerCase(Locale.ROOT));
    String name = tokens.get(0);
    return switch (name) {
      case "unrestricted", "all" -> RestrictionPolicies.unrestricted();
      case "even" -> RestrictionPolicies.even();
      case "odd" -> RestrictionPolicies.odd();
      case "triangular" -> RestrictionPolicies.triangular();
      case "residue", "mod" -> {
        requireArity(tokens, 3, raw);
        yield RestrictionPolicies.residue(
            parseLong(tokens.get(1), 0, "residue"), parseLong(tokens.get(2), 0, "modulus"));
      }
      case "max" -> {
        requireArity(tokens, 2, raw);
        yield RestrictionPolicies.atMost(parseLong(tokens.get(1), 0, "max"));
      }
      case "min" -> {
        requireArity(tokens, 2, raw);
        yield RestrictionPolicies.atLeast(parseLong(tokens.get(1), 0, "min"));
      }
      case "powers" -> {
        requireArity(tokens, 2, raw);
        yield RestrictionPolicies.powers(parseInt(tokens.get(1), 0, "powers"));
      }
      default -> throw new IllegalArgumentException("Unknown policy: " + raw);
    };
  }

  static CliOptions.OutputFormat parseFormat(String raw) {
    if (raw == null || raw.isBlank()) {
      return CliOptions.OutputFormat.TEXT;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "text", "plain" -> CliOptions.OutputFormat.TEXT;
      case "ferrers", "diagram" -> CliOptions.OutputFormat.FERRERS;
      case "json" -> CliOptions.OutputFormat.JSON;
      default -> throw new IllegalArgumentException("Invalid format: " + raw);
    };
  }

  private static void requireArity(List<String> tokens, int expected, String raw) {
    if (tokens.size() != expected) {
      throw new IllegalArgumentException(
          "Policy " + raw + " needs " + (expected - 1) + " parameter(s)");
    }
  }
}
