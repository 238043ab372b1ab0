package randompartition.testing;

/**
 * Centralized test configuration knobs. Lets Maven/JVM runners scale the statistical tests via an
 * environment variable or system property.
 */
public final class TestDefaults {
  private static final String TRIALS_PROPERTY = "randompartition.trials";
  private static final String TRIALS_ENV = "RANDOMPARTITION_TRIALS";
  private static final int DEFAULT_TRIALS_PER_OUTCOME = 1_000;

  /** Significance level below which a chi-square test is treated as a failure. */
  public static final double ALPHA = 1e-4;

  private TestDefaults() {}

  /**
   * Expected number of hits per outcome in the uniformity tests. Defaults to 1000 but can be
   * overridden via the system property {@code randompartition.trials} or environment variable
   * {@code RANDOMPARTITION_TRIALS}.
   */
  public static int trialsPerOutcome() {
    String propertyValue = System.getProperty(TRIALS_PROPERTY);
    if (propertyValue != null) {
      try {
        return Integer.parseInt(propertyValue);
      } catch (NumberFormatException ignored) {
        // fall back to env/default
      }
    }
    String envValue = System.getenv(TRIALS_ENV);
    if (envValue != null) {
      try {
        return Integer.parseInt(envValue);
      } catch (NumberFormatException ignored) {
        // fall through
      }
    }
    return DEFAULT_TRIALS_PER_OUTCOME;
  }
}
