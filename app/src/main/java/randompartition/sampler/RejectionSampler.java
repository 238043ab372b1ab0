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
 * Exact-size sampling by plain rejection: repeat the expected-size draw until its weight is the
 * target. Conditioning the {@code x^weight} law on the weight leaves the uniform distribution over
 * partitions of the target.
 *
 * <p>The expected number of attempts grows with the target (roughly like {@code sqrt(n)} when
 * unrestricted), and a target the policy cannot reach is never hit. Set {@link
 * SamplerOptions#maxAttempts()} to bound the loop.
 */
public final class RejectionSampler implements PartitionSampler {
  private static final Logger LOG = LoggerFactory.getLogger(RejectionSampler.class);

  private final ExpectedSizeSampler bulk;

  public RejectionSampler(RestrictionPolicy policy) {
    this(policy, TiltSolvers.bisection());
  }

  public RejectionSampler(RestrictionPolicy policy, TiltSolver solver) {
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

    ResolvedTilt tilt = bulk.resolveTilt(target, effective);
    MultiplicityTable table = new MultiplicityTable();
    long attempts = 0;
    do {
      if (effective.exhausted(attempts)) {
        LOG.warn("Rejection sampling gave up on n={} after {} attempts", target, attempts);
        throw new SamplingBudgetExceededException(target, attempts);
      }
      bulk.fill(table, target, tilt.x(), random);
      attempts++;
    } while (table.weight() != target);

    LOG.debug("Rejection sampling accepted n={} after {} attempts", target, attempts);
    return new SamplingResult(
        table.toPartition(),
        target,
        tilt.x(),
        tilt.solution(),
        attempts,
        stopwatch.elapsed(TimeUnit.NANOSECONDS));
  }
}
