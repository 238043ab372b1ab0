package randompartition.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import randompartition.core.IntegerPartition;

final class PartitionFormatterTest {

  @Test
  void commaSeparatedListsLargestFirst() {
    IntegerPartition partition = IntegerPartition.of(4, 17, 1, 7, 4);
    assertEquals("17,7,4,4,1", PartitionFormatter.commaSeparated(partition));
  }

  @Test
  void emptyPartitionRendersAsNothing() {
    assertEquals("", PartitionFormatter.commaSeparated(IntegerPartition.empty()));
    assertEquals("", PartitionFormatter.ferrers(IntegerPartition.empty()));
    assertTrue(PartitionFormatter.ferrersRows(IntegerPartition.empty()).isEmpty());
  }

  @Test
  void ferrersRowsStartFromSmallestPart() {
    List<String> rows = PartitionFormatter.ferrersRows(IntegerPartition.of(3, 1, 2, 1));
    assertEquals(List.of("*", "*", "* *", "* * *"), rows);
  }

  @Test
  void ferrersEndsEveryRowWithLineSeparator() {
    String nl = System.lineSeparator();
    assertEquals("* *" + nl + "* * *" + nl, PartitionFormatter.ferrers(IntegerPartition.of(3, 2)));
  }
}
