package randompartition.sampler;

import java.util.Locale;

/** Sampling algorithm selection. */
public enum SamplingMethod {
  /** Fristedt's method; the weight is only right on average. */
  EXPECTED_SIZE(false),
  REJECTION(true),
  /** Probabilistic divide-and-conquer, deterministic second half. */
  DETERMINISTIC_SECOND_HALF(true);

  private final boolean exact;

  SamplingMethod(boolean exact) {
    this.exact = exact;
  }

  /** Whether samples always have exactly the requested weight. */
  public boolean exact() {
    return exact;
  }

  /** The method behind {@link RandomPartitions#sample(long)}. */
  public static SamplingMethod recommended() {
    return DETERMINISTIC_SECOND_HALF;
  }

  /** Accepts enum names and the short forms {@code expected}, {@code rejection}, {@code dsh}. */
  public static SamplingMethod parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return recommended();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    return switch (normalized) {
      case "expected", "expected_size", "random_size" -> EXPECTED_SIZE;
      case "rejection" -> REJECTION;
      case "dsh", "pdc", "deterministic_second_half" -> DETERMINISTIC_SECOND_HALF;
      default -> throw new IllegalArgumentException("Unknown sampling method: " + raw);
    };
  }
}
