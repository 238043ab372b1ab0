package randompartition.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Factories and helpers for {@link RestrictionPolicy} instances. */
public final class RestrictionPolicies {
  private RestrictionPolicies() {}

  public static RestrictionPolicy unrestricted() {
    return StandardPolicy.UNRESTRICTED;
  }

  public static RestrictionPolicy even() {
    return StandardPolicy.EVEN;
  }

  public static RestrictionPolicy odd() {
    return StandardPolicy.ODD;
  }

  public static RestrictionPolicy triangular() {
    return StandardPolicy.TRIANGULAR;
  }

  /** Parts congruent to {@code residue} modulo {@code modulus}: {@code m(i-1)+j}. */
  public static RestrictionPolicy residue(long residue, long modulus) {
    if (residue < 1) {
      throw new IllegalArgumentException("residue must be at least 1");
    }
    if (modulus < 1) {
      throw new IllegalArgumentException("modulus must be at least 1");
    }
    return index -> modulus * (index - 1) + residue;
  }

  /** Parts no larger than {@code max}; a finite policy. */
  public static RestrictionPolicy atMost(long max) {
    if (max < 1) {
      throw new IllegalArgumentException("max part size must be at least 1");
    }
    return index -> index <= max ? index : RestrictionPolicy.NO_MORE_PARTS;
  }

  /** Parts no smaller than {@code min}. */
  public static RestrictionPolicy atLeast(long min) {
    if (min < 1) {
      throw new IllegalArgumentException("min part size must be at least 1");
    }
    return index -> index + min - 1;
  }

  /** Perfect {@code exponent}-th powers, e.g. cubes for {@code exponent == 3}. */
  public static RestrictionPolicy powers(int exponent) {
    if (exponent < 1) {
      throw new IllegalArgumentException("exponent must be at least 1");
    }
    return index -> {
      long value = 1;
      for (int k = 0; k < exponent; k++) {
        value = Math.multiplyExact(value, index);
      }
      return value;
    };
  }

  public static boolean isUnrestricted(RestrictionPolicy policy) {
    return policy == StandardPolicy.UNRESTRICTED;
  }

  /** Returns {@code u(1)}, the smallest allowed part, or {@code 0} if the policy allows none. */
  public static long smallestPart(RestrictionPolicy policy) {
    Objects.requireNonNull(policy, "policy");
    return policy.partSize(1);
  }

  /** Lists the allowed part sizes that are at most {@code bound}, in increasing order. */
  public static List<Long> allowedSizes(RestrictionPolicy policy, long bound) {
    Objects.requireNonNull(policy, "policy");
    List<Long> sizes = new ArrayList<>();
    long index = 1;
    for (long size = policy.partSize(index);
        size <= bound && size != RestrictionPolicy.NO_MORE_PARTS;
        size = policy.partSize(++index)) {
      sizes.add(size);
    }
    return sizes;
  }

  /** Whether {@code size} appears in the policy's sequence of allowed sizes. */
  public static boolean allows(RestrictionPolicy policy, long size) {
    return size > 0 && allowedSizes(policy, size).contains(size);
  }
}
