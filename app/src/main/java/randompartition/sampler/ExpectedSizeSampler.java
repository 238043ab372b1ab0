package randompartition.sampler;

import com.google.common.base.Stopwatch;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import randompartition.core.MultiplicityTable;
import randompartition.core.RestrictionPolicy;
import randompartition.tilt.TiltConvergenceException;
import randompartition.tilt.TiltSolution;
import randompartition.tilt.TiltSolver;
import randompartition.tilt.TiltSolvers;

/**
 * Fristedt's method: a partition of random weight whose expectation is the target.
 *
 * <p>Each allowed part size {@code i <= n} gets an independent geometric multiplicity with
 * success probability {@code 1 - x^i}, where {@code x} solves {@code E(x, n) = n}. A partition
 * {@code p} therefore comes out with probability proportional to {@code x^weight(p)}, so every
 * partition of the same weight is equally likely. The exact samplers build on this.
 */
public final class ExpectedSizeSampler implements PartitionSampler {
  private static final Logger LOG = LoggerFactory.getLogger(ExpectedSizeSampler.class);

  private final RestrictionPolicy policy;
  private final TiltSolver solver;

  public ExpectedSizeSampler(RestrictionPolicy policy) {
    this(policy, TiltSolvers.bisection());
  }

  public ExpectedSizeSampler(RestrictionPolicy policy, TiltSolver solver) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.solver = Objects.requireNonNull(solver, "solver");
  }

  @Override
  public RestrictionPolicy policy() {
    return policy;
  }

  @Override
  public SamplingResult sample(long target, SamplerOptions options, RandomGenerator random) {
    checkTarget(target);
    Objects.requireNonNull(random, "random");
    SamplerOptions effective = SamplerOptions.normalize(options);
    Stopwatch stopwatch = Stopwatch.createStarted();

    ResolvedTilt tilt = resolveTilt(target, effective);
    MultiplicityTable table = new MultiplicityTable();
    fill(table, target, tilt.x(), random);

    return new SamplingResult(
        table.toPartition(),
        target,
        tilt.x(),
        tilt.solution(),
        1,
        stopwatch.elapsed(TimeUnit.NANOSECONDS));
  }

  /** Uses the caller's override when present, otherwise asks the solver. */
  ResolvedTilt resolveTilt(long target, SamplerOptions options) {
    if (options.hasTiltOverride()) {
      return new ResolvedTilt(options.tiltOverride(), null);
    }
    TiltSolution solution = solver.solve(target, policy);
    if (!solution.converged() && options.requireConvergedTilt()) {
      throw new TiltConvergenceException(target, solution);
    }
    LOG.debug(
        "Solved tilt x={} for n={} in {} iterations (residual {})",
        solution.x(),
        target,
        solution.iterations(),
        solution.residual());
    return new ResolvedTilt(solution.x(), solution);
  }

  /**
   * Overwrites {@code table} with one independent draw of every multiplicity for sizes up to
   * {@code bound}. Zero multiplicities are left out.
   */
  void fill(MultiplicityTable table, long bound, double x, RandomGenerator random) {
    table.clear();
    double logX = Math.log(x);
    long index = 1;
    for (long size = policy.partSize(index);
        size <= bound && size != RestrictionPolicy.NO_MORE_PARTS;
        size = policy.partSize(++index)) {
      long count = geometric(size, logX, random);
      if (count != 0) {
        table.set(size, count);
      }
    }
  }

  /**
   * Inverse transform: {@code floor(ln A / (size ln x))} with {@code A} uniform on (0, 1] is
   * geometric with {@code P(count >= k) = x^(size k)}.
   */
  static long geometric(long size, double logX, RandomGenerator random) {
    double uniform = 1.0 - random.nextDouble();
    return (long) Math.floor(Math.log(uniform) / (size * logX));
  }

  static void checkTarget(long target) {
    if (target < 0) {
      throw new IllegalArgumentException("target must be non-negative: " + target);
    }
  }

  /** Tilt for one call; {@code solution} is {@code null} when the caller supplied the value. */
  record ResolvedTilt(double x, TiltSolution solution) {}
}
