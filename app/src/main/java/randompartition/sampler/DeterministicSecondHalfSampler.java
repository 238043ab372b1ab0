package randompartition.sampler;

import com.google.common.base.Stopwatch;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import randompartition.core.MultiplicityTable;
import randompartition.core.RestrictionPolicy;
import randompartition.sampler.ExpectedSizeSampler.ResolvedTilt;
import randompartition.tilt.TiltSolver;
import randompartition.tilt.TiltSolvers;

/**
 * Probabilistic divide-and-conquer with a deterministic second half.
 *
 * <p>Every multiplicity except the one of the smallest allowed size {@code s = u(1)} is drawn by
 * Fristedt's method. The remaining gap {@code d = n - partial} can only be closed by {@code d / s}
 * copies of {@code s}, so the draw is kept when {@code d >= 0}, {@code s} divides {@code d}, and a
 * fresh uniform is at most {@code x^d}. That ratio is the probability of {@code d / s} smallest
 * parts relative to none under the geometric law, so accepted partitions are uniform over the
 * partitions of {@code n}, exactly as with {@link RejectionSampler}, while far fewer draws are
 * thrown away.
 *
 * <p>See S. DeSalvo, "Probabilistic divide-and-conquer: deterministic second half", arXiv.
 */
public final class DeterministicSecondHalfSampler implements PartitionSampler {
  private static final Logger LOG = LoggerFactory.getLogger(DeterministicSecondHalfSampler.class);

  private final ExpectedSizeSampler bulk;

  public DeterministicSecondHalfSampler(RestrictionPolicy policy) {
    this(policy, TiltSolvers.bisection());
  }

  public DeterministicSecondHalfSampler(RestrictionPolicy policy, TiltSolver solver) {
    this.bulk = new ExpectedSizeSampler(policy, solver);
  }

  @Override
  public RestrictionPolicy policy() {
    return bulk.policy();
  }

  @Override
  public SamplingResult sample(long target, SamplerOptions options, RandomGenerator random) {
    ExpectedSizeSampler.checkTarget(target);
    Objects.requireNonNull(random, "random");
    SamplerOptions effective = SamplerOptions.normalize(options);
    Stopwatch stopwatch = Stopwatch.createStarted();

    long smallest = policy().partSize(1);
    if (smallest == RestrictionPolicy.NO_MORE_PARTS && target > 0) {
      throw new IllegalArgumentException("policy allows no part sizes, cannot reach " + target);
    }

    // Solved once per call, the target does not change between attempts.
    ResolvedTilt tilt = bulk.resolveTilt(target, effective);
    MultiplicityTable table = new MultiplicityTable();
    long attempts = 0;
    boolean accepted = false;
    while (!accepted) {
      if (effective.exhausted(attempts)) {
        LOG.warn("PDC sampling gave up on n={} after {} attempts", target, attempts);
        throw new SamplingBudgetExceededException(target, attempts);
      }
      bulk.fill(table, target, tilt.x(), random);
      attempts++;
      if (target == 0) {
        break;
      }
      table.set(smallest, 0);

      long partial = table.weight();
      long gap = target - partial;
      if (partial <= target
          && gap % smallest == 0
          && random.nextDouble() <= Math.pow(tilt.x(), gap)) {
        table.set(smallest, gap / smallest);
        accepted = true;
      }
    }

    LOG.debug("PDC sampling accepted n={} after {} attempts", target, attempts);
    return new SamplingResult(
        table.toPartition(),
        target,
        tilt.x(),
        tilt.solution(),
        attempts,
        stopwatch.elapsed(TimeUnit.NANOSECONDS));
  }
}
