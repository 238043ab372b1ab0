package randompartition.sampler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;
import randompartition.core.IntegerPartition;
import randompartition.core.RestrictionPolicies;
import randompartition.core.RestrictionPolicy;
import randompartition.tilt.TiltSolver;
import randompartition.tilt.TiltSolvers;

/**
 * Default entry point for random partitions of an exact size.
 *
 * <p>{@link #sample(long)} always returns a uniformly random partition of the requested weight
 * using the fastest correct method available, currently {@link
 * DeterministicSecondHalfSampler}. The algorithm behind it may change; callers who need a fixed
 * algorithm should use {@link #sampleWith(SamplingMethod, long)} or a sampler directly.
 *
 * <p>Each instance owns its random generator and is therefore not safe for concurrent use. Give
 * every thread its own instance.
 */
public final class RandomPartitions {
  private final RestrictionPolicy policy;
  private final RandomGenerator random;
  private final Map<SamplingMethod, PartitionSampler> samplers =
      new EnumMap<>(SamplingMethod.class);

  public RandomPartitions(RestrictionPolicy policy, TiltSolver solver, RandomGenerator random) {
    this.policy = Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(solver, "solver");
    this.random = Objects.requireNonNull(random, "random");
    samplers.put(SamplingMethod.EXPECTED_SIZE, new ExpectedSizeSampler(policy, solver));
    samplers.put(SamplingMethod.REJECTION, new RejectionSampler(policy, solver));
    samplers.put(
        SamplingMethod.DETERMINISTIC_SECOND_HALF,
        new DeterministicSecondHalfSampler(policy, solver));
  }

  public static RandomPartitions unrestricted() {
    return of(RestrictionPolicies.unrestricted());
  }

  /** Uses a generator seeded from the clock. */
  public static RandomPartitions of(RestrictionPolicy policy) {
    return of(policy, new SplittableRandom());
  }

  public static RandomPartitions of(RestrictionPolicy policy, RandomGenerator random) {
    return new RandomPartitions(policy, TiltSolvers.bisection(), random);
  }

  public static RandomPartitions seeded(RestrictionPolicy policy, long seed) {
    return of(policy, new SplittableRandom(seed));
  }

  public RestrictionPolicy policy() {
    return policy;
  }

  /** Uniformly random partition of exactly {@code target}. */
  public IntegerPartition sample(long target) {
    return sample(target, SamplerOptions.defaults());
  }

  public IntegerPartition sample(long target, SamplerOptions options) {
    return run(target, options).partition();
  }

  /** Like {@link #sample(long, SamplerOptions)} but keeps the attempt and tilt statistics. */
  public SamplingResult run(long target, SamplerOptions options) {
    return runWith(SamplingMethod.recommended(), target, options);
  }

  public IntegerPartition sampleWith(SamplingMethod method, long target) {
    return runWith(method, target, SamplerOptions.defaults()).partition();
  }

  public SamplingResult runWith(SamplingMethod method, long target, SamplerOptions options) {
    return sampler(method).sample(target, options, random);
  }

  public PartitionSampler sampler(SamplingMethod method) {
    Objects.requireNonNull(method, "method");
    return samplers.get(method);
  }
}
