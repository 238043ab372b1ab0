package randompartition.format;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import randompartition.core.IntegerPartition;

/** Text renderings of a partition for display. */
public final class PartitionFormatter {
  private static final Joiner COMMA = Joiner.on(',');
  private static final String CELL = "*";

  private PartitionFormatter() {}

  /** Parts from largest to smallest, e.g. {@code 17,7,4,4,1}. Empty for the empty partition. */
  public static String commaSeparated(IntegerPartition partition) {
    Objects.requireNonNull(partition, "partition");
    return COMMA.join(partition.parts());
  }

  /**
   * Ferrers diagram with one row of cells per part. Rows run from the smallest part at the top to
   * the largest at the bottom, so a tall column of ones reads first.
   */
  public static String ferrers(IntegerPartition partition) {
    Objects.requireNonNull(partition, "partition");
    StringBuilder out = new StringBuilder();
    for (long part : Lists.reverse(partition.parts())) {
      out.append(row(part)).append(System.lineSeparator());
    }
    return out.toString();
  }

  /** Rows of {@link #ferrers(IntegerPartition)} without line separators. */
  public static List<String> ferrersRows(IntegerPartition partition) {
    Objects.requireNonNull(partition, "partition");
    return Lists.reverse(partition.parts()).stream().map(PartitionFormatter::row).toList();
  }

  private static String row(long part) {
    return String.join(" ", Collections.nCopies(Math.toIntExact(part), CELL));
  }
}
