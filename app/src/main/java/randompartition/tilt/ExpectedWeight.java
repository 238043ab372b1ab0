package randompartition.tilt;

import java.util.Objects;
import randompartition.core.RestrictionPolicy;

/**
 * Expected weight of a random partition whose multiplicities are independent geometric variables.
 *
 * <p>Part size {@code i} contributes {@code i x^i / (1 - x^i)}. Only allowed sizes up to the bound
 * are summed, so the result is finite for every {@code x} in (0, 1) and increases with {@code x}
 * as long as at least one allowed size fits under the bound.
 */
public final class ExpectedWeight {
  private ExpectedWeight() {}

  /**
   * Computes {@code sum over allowed i <= bound of i x^i / (1 - x^i)}.
   *
   * @param x tilt, expected in (0, 1)
   * @param bound largest part size considered, usually the target weight
   * @param policy allowed part sizes
   * @return expected weight under tilt {@code x}
   */
  public static double of(double x, long bound, RestrictionPolicy policy) {
    Objects.requireNonNull(policy, "policy");
    double total = 0.0;
    long index = 1;
    // The sentinel check lets finite policies stop before the bound.
    for (long size = policy.partSize(index);
        size <= bound && size != RestrictionPolicy.NO_MORE_PARTS;
        size = policy.partSize(++index)) {
      double power = Math.pow(x, size);
      total += size * power / (1.0 - power);
    }
    return total;
  }
}
