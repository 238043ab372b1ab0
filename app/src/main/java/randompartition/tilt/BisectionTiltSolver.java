package randompartition.tilt;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import randompartition.core.RestrictionPolicy;

/**
 * Solves for the tilt by bisection. Works for every restriction policy.
 *
 * <p>The bracket starts at {@code [1 - c / sqrt(n), 1 - 1e-16]} with {@code c = pi / sqrt(6)}, the
 * unrestricted asymptotic root, and halves until the residuals at both ends differ by at most
 * {@link #DEFAULT_TOLERANCE} or the iteration cap is reached. Reaching the cap is not an error:
 * the current midpoint is returned and {@link TiltSolution#converged()} reports {@code false}.
 */
public final class BisectionTiltSolver implements TiltSolver {
  private static final Logger LOG = LoggerFactory.getLogger(BisectionTiltSolver.class);

  /** {@code pi / sqrt(6)}. */
  public static final double HARDY_RAMANUJAN_CONSTANT = 1.2825498301618643;

  public static final double DEFAULT_TOLERANCE = 1e-5;
  public static final int DEFAULT_MAX_ITERATIONS = 1000;

  // Rounds to the largest double below 1.
  static final double UPPER_BRACKET = 1.0 - 1e-16;

  // Midpoint returned when the loop never runs, as in an already collapsed bracket.
  private static final double INITIAL_MIDPOINT = 0.1;

  private final double tolerance;
  private final int maxIterations;

  public BisectionTiltSolver() {
    this(DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS);
  }

  public BisectionTiltSolver(double tolerance, int maxIterations) {
    if (!(tolerance > 0.0)) {
      throw new IllegalArgumentException("tolerance must be positive");
    }
    if (maxIterations < 1) {
      throw new IllegalArgumentException("maxIterations must be at least 1");
    }
    this.tolerance = tolerance;
    this.maxIterations = maxIterations;
  }

  @Override
  public TiltSolution solve(long target, RestrictionPolicy policy) {
    Objects.requireNonNull(policy, "policy");
    if (target < 0) {
      throw new IllegalArgumentException("target must be non-negative: " + target);
    }
    long smallest = policy.partSize(1);
    if (target == 0 || smallest == RestrictionPolicy.NO_MORE_PARTS || smallest > target) {
      // E(x, n) is identically zero here, there is no root to bracket.
      return TiltSolution.degenerate(target);
    }

    double lower = Math.max(0.0, 1.0 - HARDY_RAMANUJAN_CONSTANT / Math.sqrt(target));
    double upper = UPPER_BRACKET;
    double lowerResidual = residual(lower, target, policy);
    double upperResidual = residual(upper, target, policy);
    double midpoint = INITIAL_MIDPOINT;
    double midpointResidual = residual(midpoint, target, policy);

    int iterations = 0;
    while (Math.abs(lowerResidual - upperResidual) > tolerance && iterations < maxIterations) {
      midpoint = (lower + upper) / 2.0;
      midpointResidual = residual(midpoint, target, policy);
      if (midpointResidual < 0) {
        lower = midpoint;
        lowerResidual = midpointResidual;
      } else {
        upper = midpoint;
        upperResidual = midpointResidual;
      }
      iterations++;
    }

    boolean converged = Math.abs(lowerResidual - upperResidual) <= tolerance;
    if (!converged) {
      LOG.debug(
          "Tilt bisection for n={} stopped after {} iterations with residual {}",
          target,
          iterations,
          midpointResidual);
    }
    return new TiltSolution(midpoint, iterations, midpointResidual, converged);
  }

  private static double residual(double x, long target, RestrictionPolicy policy) {
    return ExpectedWeight.of(x, target, policy) - target;
  }
}
