package randompartition.tilt;

/**
 * Outcome of a tilt search.
 *
 * @param x the tilt
 * @param iterations bisection steps taken, {@code 0} for closed-form solutions
 * @param residual {@code E(x, n) - n} at the returned tilt
 * @param converged whether the search met its tolerance before running out of iterations
 */
public record TiltSolution(double x, int iterations, double residual, boolean converged) {

  /** Tilt used when no allowed part fits under the target and the equation has no root. */
  public static final double DEGENERATE_TILT = 0.5;

  public TiltSolution {
    if (!(x > 0.0 && x < 1.0)) {
      throw new IllegalArgumentException("tilt must lie in (0, 1): " + x);
    }
  }

  /**
   * Solution for a target whose expected weight is identically zero. It counts as converged only
   * for target {@code 0}, where zero is the right answer.
   */
  public static TiltSolution degenerate(long target) {
    return new TiltSolution(DEGENERATE_TILT, 0, -target, target == 0);
  }
}
