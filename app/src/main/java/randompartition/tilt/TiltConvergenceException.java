package randompartition.tilt;

/** Raised when a caller asked for a converged tilt and the solver could not provide one. */
public final class TiltConvergenceException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final long target;
  private final transient TiltSolution solution;

  public TiltConvergenceException(long target, TiltSolution solution) {
    super(
        "Tilt for target "
            + target
            + " did not converge after "
            + solution.iterations()
            + " iterations (residual "
            + solution.residual()
            + ")");
    this.target = target;
    this.solution = solution;
  }

  public long target() {
    return target;
  }

  public TiltSolution solution() {
    return solution;
  }
}
