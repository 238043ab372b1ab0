package randompartition.sampler;

import java.util.random.RandomGenerator;
import randompartition.core.IntegerPartition;
import randompartition.core.RestrictionPolicy;

/** Draws random partitions whose parts obey a {@link RestrictionPolicy}. */
public interface PartitionSampler {

  RestrictionPolicy policy();

  /**
   * Draws one partition.
   *
   * @param target requested weight, non-negative
   * @param options per-call knobs; {@code null} means {@link SamplerOptions#defaults()}
   * @param random source of uniform variates, owned by the caller
   * @return the partition and the statistics of the call
   */
  SamplingResult sample(long target, SamplerOptions options, RandomGenerator random);

  default IntegerPartition sample(long target, RandomGenerator random) {
    return sample(target, SamplerOptions.defaults(), random).partition();
  }
}
