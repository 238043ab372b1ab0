package randompartition.sampler;

/**
 * Per-call knobs shared by all samplers.
 *
 * @param tiltOverride tilt to use instead of solving for one; values {@code >= 1} mean "solve"
 * @param maxAttempts cap on draws for the exact samplers; {@code 0} means unbounded
 * @param requireConvergedTilt fail with {@link randompartition.tilt.TiltConvergenceException}
 *     instead of using a tilt whose search hit its iteration cap
 */
public record SamplerOptions(
    double tiltOverride, long maxAttempts, boolean requireConvergedTilt) {

  /** Sentinel for "no override", the solver picks the tilt. */
  public static final double NO_TILT_OVERRIDE = 1.0;

  public static final long UNBOUNDED_ATTEMPTS = 0L;

  public SamplerOptions {
    if (Double.isNaN(tiltOverride) || tiltOverride <= 0.0) {
      throw new IllegalArgumentException("tilt override must be positive: " + tiltOverride);
    }
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("maxAttempts must be non-negative");
    }
  }

  public static SamplerOptions defaults() {
    return new SamplerOptions(NO_TILT_OVERRIDE, UNBOUNDED_ATTEMPTS, false);
  }

  public static SamplerOptions normalize(SamplerOptions options) {
    return options == null ? defaults() : options;
  }

  public static SamplerOptions withTilt(double tilt) {
    return defaults().tilt(tilt);
  }

  public boolean hasTiltOverride() {
    return tiltOverride < 1.0;
  }

  public boolean bounded() {
    return maxAttempts > 0;
  }

  /** Whether {@code attempts} draws have used up the budget. */
  boolean exhausted(long attempts) {
    return bounded() && attempts >= maxAttempts;
  }

  public SamplerOptions tilt(double tilt) {
    return new SamplerOptions(tilt, maxAttempts, requireConvergedTilt);
  }

  public SamplerOptions attempts(long maxAttempts) {
    return new SamplerOptions(tiltOverride, maxAttempts, requireConvergedTilt);
  }

  public SamplerOptions strictTilt(boolean requireConvergedTilt) {
    return new SamplerOptions(tiltOverride, maxAttempts, requireConvergedTilt);
  }
}
