package randompartition.tilt;

import randompartition.core.RestrictionPolicy;

/** Finds the tilt whose expected partition weight equals a target. */
@FunctionalInterface
public interface TiltSolver {

  /**
   * Solves {@code E(x, target) = target} for {@code x} in (0, 1).
   *
   * @param target desired expected weight, non-negative
   * @param policy allowed part sizes
   * @return the tilt together with how it was obtained
   */
  TiltSolution solve(long target, RestrictionPolicy policy);
}
