package randompartition.core;

import java.util.TreeMap;

/**
 * Mutable part size to multiplicity map filled by a sampler during a single call.
 *
 * <p>Unlike {@link IntegerPartition} the table may hold zero multiplicities, which the
 * deterministic second half sampler relies on for the smallest part while it decides whether to
 * accept a draw. {@link #toPartition()} drops them.
 */
public final class MultiplicityTable {
  private final TreeMap<Long, Long> counts = new TreeMap<>();

  public void clear() {
    counts.clear();
  }

  public void set(long size, long multiplicity) {
    if (multiplicity < 0) {
      throw new IllegalArgumentException("multiplicity must be non-negative");
    }
    counts.put(size, multiplicity);
  }

  public void add(long size, long multiplicity) {
    counts.merge(size, multiplicity, Long::sum);
  }

  public long multiplicity(long size) {
    return counts.getOrDefault(size, 0L);
  }

  public boolean contains(long size) {
    return counts.containsKey(size);
  }

  /** Weight of the table; zero entries contribute nothing. */
  public long weight() {
    long total = 0;
    for (var entry : counts.entrySet()) {
      total += entry.getKey() * entry.getValue();
    }
    return total;
  }

  public IntegerPartition toPartition() {
    return counts.isEmpty() ? IntegerPartition.empty() : new IntegerPartition(counts);
  }
}
