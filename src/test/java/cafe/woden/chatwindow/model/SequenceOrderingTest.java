package cafe.woden.chatwindow.model;

import static cafe.woden.chatwindow.support.TestMessages.msg;
import static cafe.woden.chatwindow.support.TestMessages.newestFirst;
import static cafe.woden.chatwindow.support.TestMessages.range;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.junit.jupiter.api.Test;

class SequenceOrderingTest {

  @Test
  void threeWayComparatorFollowsBeforeAndAfter() {
    Comparator<ChatMessage> cmp = SequenceOrdering.threeWay();

    assertTrue(cmp.compare(msg(1), msg(2)) < 0);
    assertTrue(cmp.compare(msg(2), msg(1)) > 0);
    assertEquals(0, cmp.compare(msg(3), msg(3)));
  }

  @Test
  void indexOfSerialFindsEveryElementInAscendingList() {
    List<ChatMessage> items = range(1, 9);

    for (int i = 0; i < items.size(); i++) {
      assertEquals(i, SequenceOrdering.indexOfSerial(items, items.get(i).serial(), false));
    }
    assertEquals(-1, SequenceOrdering.indexOfSerial(items, "0042", false));
  }

  @Test
  void indexOfSerialSearchesNewestFirstListsInReverseMode() {
    List<ChatMessage> page = newestFirst(40, 59);

    assertEquals(9, SequenceOrdering.indexOfSerial(page, "0050", true));
    assertEquals(0, SequenceOrdering.indexOfSerial(page, "0059", true));
    assertEquals(-1, SequenceOrdering.indexOfSerial(page, "0060", true));
    assertEquals(-1, SequenceOrdering.indexOfSerial(page, "0045", false));
  }

  @Test
  void indexOfSerialHandlesEmptyAndNullInput() {
    assertEquals(-1, SequenceOrdering.indexOfSerial(List.of(), "0001", false));
    assertEquals(-1, SequenceOrdering.indexOfSerial(null, "0001", false));
    assertEquals(-1, SequenceOrdering.indexOfSerial(range(1, 3), null, false));
  }

  @Test
  void insertionIndexKeepsListSorted() {
    List<ChatMessage> items = new ArrayList<>(List.of(msg(10), msg(20), msg(30)));

    assertEquals(0, SequenceOrdering.insertionIndex(items, msg(5)));
    assertEquals(1, SequenceOrdering.insertionIndex(items, msg(15)));
    assertEquals(2, SequenceOrdering.insertionIndex(items, msg(25)));
    assertEquals(3, SequenceOrdering.insertionIndex(items, msg(35)));
    assertEquals(0, SequenceOrdering.insertionIndex(List.of(), msg(1)));
  }

  @Test
  void insertionIndexUsesOrderingPredicatesRatherThanSerialText() {
    List<Numbered> items = List.of(new Numbered(2), new Numbered(9), new Numbered(100));

    assertEquals(2, SequenceOrdering.insertionIndex(items, new Numbered(10)));
    assertEquals(3, SequenceOrdering.insertionIndex(items, new Numbered(100)));
    assertEquals(0, SequenceOrdering.insertionIndex(items, new Numbered(1)));
  }

  /** Orders numerically, so "10" sorts after "9" even though it is lexicographically smaller. */
  private record Numbered(int n) implements Sequenced {
    @Override
    public String serial() {
      return Integer.toString(n);
    }

    @Override
    public boolean before(Sequenced other) {
      return n < ((Numbered) other).n;
    }

    @Override
    public boolean after(Sequenced other) {
      return n > ((Numbered) other).n;
    }
  }
}
