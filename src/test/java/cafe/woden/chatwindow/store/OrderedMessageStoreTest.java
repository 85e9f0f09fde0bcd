package cafe.woden.chatwindow.store;

import static cafe.woden.chatwindow.support.TestMessages.edited;
import static cafe.woden.chatwindow.support.TestMessages.msg;
import static cafe.woden.chatwindow.support.TestMessages.range;
import static cafe.woden.chatwindow.support.TestMessages.serials;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.chatwindow.model.Anchor;
import cafe.woden.chatwindow.model.ChatMessage;
import cafe.woden.chatwindow.model.ReactionSummary;
import cafe.woden.chatwindow.model.ReactionSummaryEvent;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class OrderedMessageStoreTest {

  private final OrderedMessageStore store = new OrderedMessageStore();

  @Test
  void midSequenceInsertKeepsOrderAndTailAnchor() {
    store.integrate(List.of(msg("0001"), msg("0003")), false);

    boolean changed = store.integrate(List.of(msg("0002")), false);

    assertTrue(changed);
    assertEquals(List.of("0001", "0002", "0003"), serials(store.snapshot()));
    assertTrue(store.anchor().isTail());
    assertEquals(2, store.anchor().resolve(store.size()));
    assertEquals("0003", store.last().orElseThrow().serial());
  }

  @Test
  void arbitraryArrivalOrderYieldsSortedSequenceWithoutDuplicates() {
    Random random = new Random(42);
    List<ChatMessage> all = new ArrayList<>(range(1, 300));

    for (int round = 0; round < 5; round++) {
      Collections.shuffle(all, random);
      int i = 0;
      while (i < all.size()) {
        int n = 1 + random.nextInt(17);
        List<ChatMessage> batch = all.subList(i, Math.min(all.size(), i + n));
        store.integrate(new ArrayList<>(batch), random.nextBoolean());
        i += n;
      }
    }

    List<String> got = serials(store.snapshot());
    assertEquals(300, got.size());
    assertEquals(300, new HashSet<>(got).size());
    for (int i = 1; i < got.size(); i++) {
      assertTrue(got.get(i - 1).compareTo(got.get(i)) < 0, "out of order at " + i);
    }
  }

  @Test
  void integratingSameBatchTwiceIsIdempotent() {
    List<ChatMessage> batch = List.of(msg(5), msg(1), msg(3));

    assertTrue(store.integrate(batch, false));
    List<ChatMessage> afterFirst = store.snapshot();
    long version = store.version();

    assertFalse(store.integrate(batch, false));
    assertFalse(store.integrate(batch, true));

    assertEquals(afterFirst, store.snapshot());
    assertEquals(version, store.version());
  }

  @Test
  void knownSerialIsReplacedOnlyWhenMergeChangesIt() {
    store.integrate(range(1, 3), false);
    ChatMessage original = store.snapshot().get(1);

    assertFalse(store.integrate(List.of(msg(2)), false));
    assertSame(original, store.snapshot().get(1));

    assertTrue(store.integrate(List.of(edited("0002", "0100", "edited")), false));
    assertEquals("edited", store.snapshot().get(1).text());
    assertEquals(3, store.size());
  }

  @Test
  void prependInsertsOlderMessagesAtHead() {
    store.integrate(range(10, 12), false);

    store.integrate(List.of(msg(9), msg(8), msg(7)), true);

    assertEquals(
        List.of("0007", "0008", "0009", "0010", "0011", "0012"), serials(store.snapshot()));
  }

  @Test
  void prependingOlderMessagesShiftsConcreteAnchorToSameMessage() {
    store.integrate(range(10, 19), false);
    store.setAnchor(Anchor.at(4));
    String anchored = store.snapshot().get(4).serial();

    store.integrate(range(1, 5), true);

    assertEquals(9, store.anchor().index());
    assertEquals(anchored, store.snapshot().get(store.anchor().index()).serial());
  }

  @Test
  void insertionsBeforeAnchorShiftItButLaterOnesDoNot() {
    store.integrate(List.of(msg(10), msg(20), msg(30), msg(40), msg(50)), false);
    store.setAnchor(Anchor.at(2));

    store.integrate(List.of(msg(15), msg(45), msg(5), msg(60)), false);

    assertEquals("0030", store.snapshot().get(store.anchor().index()).serial());
    assertEquals(4, store.anchor().index());
  }

  @Test
  void insertionExactlyAtAnchorIndexShiftsAnchor() {
    store.integrate(List.of(msg(10), msg(20), msg(30)), false);
    store.setAnchor(Anchor.at(1));

    store.integrate(List.of(msg(15)), false);

    assertEquals("0020", store.snapshot().get(store.anchor().index()).serial());
  }

  @Test
  void reactionSummaryForUnknownSerialIsDropped() {
    store.integrate(range(1, 2), false);
    long version = store.version();

    boolean changed =
        store.applyReactionSummary(new ReactionSummaryEvent("0099", ReactionSummary.EMPTY));

    assertFalse(changed);
    assertEquals(version, store.version());
  }

  @Test
  void reactionSummaryIsMergedIntoKnownMessage() {
    store.integrate(range(1, 2), false);
    ReactionSummary summary =
        new ReactionSummary(Map.of("heart", new ReactionSummary.ReactionCount(3, Set.of())));

    assertTrue(store.applyReactionSummary(new ReactionSummaryEvent("0002", summary)));
    assertFalse(store.applyReactionSummary(new ReactionSummaryEvent("0002", summary)));

    assertEquals(3, store.snapshot().get(1).reactions().total("heart"));
  }

  @Test
  void changesAreEmittedOncePerChangingBatch() {
    TestSubscriber<OrderedMessageStore.StoreChange> sub = store.changes().test();

    store.integrate(range(1, 5), false);
    store.integrate(range(1, 5), false);
    store.integrate(List.of(msg(6)), false);

    sub.assertValues(
        new OrderedMessageStore.StoreChange(1, 5), new OrderedMessageStore.StoreChange(2, 6));
  }

  @Test
  void messagesWithoutSerialAreSkipped() {
    List<ChatMessage> batch = Arrays.asList(msg(1), null, msg(""));

    store.integrate(batch, false);

    assertEquals(List.of("0001"), serials(store.snapshot()));
  }

  @Test
  void clearResetsSequenceIndexAndAnchor() {
    store.integrate(range(1, 5), false);
    store.setAnchor(Anchor.at(2));

    store.clear();

    assertTrue(store.isEmpty());
    assertFalse(store.contains("0001"));
    assertTrue(store.anchor().isTail());
    assertTrue(store.integrate(List.of(msg(1)), false));
  }

  @Test
  void viewTracksSequenceAndRejectsWrites() {
    List<ChatMessage> view = store.view();
    store.integrate(range(1, 3), false);

    assertEquals(List.of("0001", "0002", "0003"), serials(view));
    assertThrows(UnsupportedOperationException.class, () -> view.add(msg(4)));
  }
}
