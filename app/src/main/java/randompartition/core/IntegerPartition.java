package randompartition.core;

import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;

/**
 * An integer partition stored as part size to multiplicity.
 *
 * <p>Instances are immutable and never contain a zero multiplicity. The parts view is rebuilt from
 * the multiplicities on every call and is ordered from the largest part to the smallest.
 */
public record IntegerPartition(NavigableMap<Long, Long> multiplicities) {

  private static final IntegerPartition EMPTY = new IntegerPartition(ImmutableSortedMap.of());

  public IntegerPartition {
    Objects.requireNonNull(multiplicities, "multiplicities");
    ImmutableSortedMap.Builder<Long, Long> builder = ImmutableSortedMap.naturalOrder();
    for (Map.Entry<Long, Long> entry : multiplicities.entrySet()) {
      long size = entry.getKey();
      long count = entry.getValue();
      if (size < 1) {
        throw new IllegalArgumentException("part sizes must be positive: " + size);
      }
      if (count < 0) {
        throw new IllegalArgumentException("multiplicity of " + size + " is negative: " + count);
      }
      if (count > 0) {
        builder.put(size, count);
      }
    }
    multiplicities = builder.build();
  }

  public static IntegerPartition empty() {
    return EMPTY;
  }

  /** Builds a partition from its parts, given in any order. */
  public static IntegerPartition of(long... parts) {
    MultiplicityTable table = new MultiplicityTable();
    for (long part : parts) {
      table.add(part, 1);
    }
    return table.toPartition();
  }

  /** Total of all parts. */
  public long weight() {
    long total = 0;
    for (Map.Entry<Long, Long> entry : multiplicities.entrySet()) {
      total = Math.addExact(total, Math.multiplyExact(entry.getKey(), entry.getValue()));
    }
    return total;
  }

  public long multiplicity(long size) {
    return multiplicities.getOrDefault(size, 0L);
  }

  public int distinctPartCount() {
    return multiplicities.size();
  }

  public long partCount() {
    long count = 0;
    for (long multiplicity : multiplicities.values()) {
      count += multiplicity;
    }
    return count;
  }

  public boolean isEmpty() {
    return multiplicities.isEmpty();
  }

  /** Largest part, or {@code 0} for the empty partition. */
  public long largestPart() {
    return isEmpty() ? 0L : multiplicities.lastKey();
  }

  /** Parts in descending order, each repeated according to its multiplicity. */
  public List<Long> parts() {
    List<Long> parts = new ArrayList<>();
    for (Map.Entry<Long, Long> entry : multiplicities.descendingMap().entrySet()) {
      parts.addAll(Collections.nCopies(Math.toIntExact(entry.getValue()), entry.getKey()));
    }
    return parts;
  }

  @Override
  public String toString() {
    return "IntegerPartition" + parts();
  }
}
