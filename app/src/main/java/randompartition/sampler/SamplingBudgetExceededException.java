package randompartition.sampler;

/** Raised when an exact sampler used up its attempt budget without hitting the target weight. */
public final class SamplingBudgetExceededException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final long target;
  private final long attempts;

  public SamplingBudgetExceededException(long target, long attempts) {
    super("No partition of " + target + " accepted within " + attempts + " attempts");
    this.target = target;
    this.attempts = attempts;
  }

  public long target() {
    return target;
  }

  public long attempts() {
    return attempts;
  }
}
