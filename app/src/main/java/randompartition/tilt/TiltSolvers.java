package randompartition.tilt;

import randompartition.core.RestrictionPolicies;
import randompartition.core.RestrictionPolicy;

/**
 * Picks a {@link TiltSolver}.
 *
 * <p>Samplers default to {@link #bisection()}, which handles every policy and is the most
 * accurate. {@link #fastestFor(RestrictionPolicy)} opts into the closed-form table when the
 * policy is unrestricted.
 */
public final class TiltSolvers {
  private static final TiltSolver BISECTION = new BisectionTiltSolver();
  private static final TiltSolver UNRESTRICTED_TABLE = new UnrestrictedTiltTable();

  private TiltSolvers() {}

  public static TiltSolver bisection() {
    return BISECTION;
  }

  public static TiltSolver unrestrictedTable() {
    return UNRESTRICTED_TABLE;
  }

  public static TiltSolver fastestFor(RestrictionPolicy policy) {
    return RestrictionPolicies.isUnrestricted(policy) ? UNRESTRICTED_TABLE : BISECTION;
  }
}
