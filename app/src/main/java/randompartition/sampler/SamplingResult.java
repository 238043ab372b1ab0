package randompartition.sampler;

import java.util.Objects;
import randompartition.core.IntegerPartition;
import randompartition.tilt.TiltSolution;

/**
 * A sampled partition together with how it was produced.
 *
 * @param partition the sample
 * @param target requested weight (expected weight for the expected-size sampler)
 * @param tilt tilt actually used for the draws
 * @param tiltSolution solver output, or {@code null} when the caller overrode the tilt
 * @param attempts number of draws, including the accepted one
 * @param elapsedNanos wall time of the whole call
 */
public record SamplingResult(
    IntegerPartition partition,
    long target,
    double tilt,
    TiltSolution tiltSolution,
    long attempts,
    long elapsedNanos) {

  public SamplingResult {
    Objects.requireNonNull(partition, "partition");
  }

  public long weight() {
    return partition.weight();
  }

  public boolean exact() {
    return partition.weight() == target;
  }

  public boolean tiltOverridden() {
    return tiltSolution == null;
  }
}
