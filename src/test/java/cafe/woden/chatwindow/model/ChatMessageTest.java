package cafe.woden.chatwindow.model;

import static cafe.woden.chatwindow.support.TestMessages.deleted;
import static cafe.woden.chatwindow.support.TestMessages.edited;
import static cafe.woden.chatwindow.support.TestMessages.msg;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ChatMessageTest {

  private static ReactionSummary thumbsUp(int total) {
    return new ReactionSummary(
        Map.of(":+1:", new ReactionSummary.ReactionCount(total, Set.of("bob"))));
  }

  @Test
  void newlyCreatedMessageCarriesInitialVersion() {
    ChatMessage m = msg("0007");

    assertEquals("0007", m.version().serial());
    assertEquals(MessageAction.CREATED, m.action());
    assertFalse(m.isUpdated());
    assertFalse(m.isDeleted());
    assertTrue(m.reactions().isEmpty());
  }

  @Test
  void beforeAndAfterCompareSerials() {
    assertTrue(msg(1).before(msg(2)));
    assertTrue(msg(2).after(msg(1)));
    assertFalse(msg(2).before(msg(2)));
    assertFalse(msg(2).after(msg(2)));
  }

  @Test
  void mergeWithNewerVersionTakesIncomingContent() {
    ChatMessage stored = msg("0001");
    ChatMessage edit = edited("0001", "0009", "fixed typo");

    ChatMessage merged = stored.mergedWith(edit);

    assertEquals("fixed typo", merged.text());
    assertTrue(merged.isUpdated());
    assertEquals("0009", merged.version().serial());
  }

  @Test
  void mergeWithOlderOrSameVersionReturnsStoredInstance() {
    ChatMessage stored = edited("0001", "0009", "latest");

    assertSame(stored, stored.mergedWith(msg("0001")));
    assertSame(stored, stored.mergedWith(edited("0001", "0009", "duplicate delivery")));
  }

  @Test
  void mergeKeepsStoredReactions() {
    ChatMessage stored =
        msg("0001").mergedWith(new ReactionSummaryEvent("0001", thumbsUp(2)));

    ChatMessage merged = stored.mergedWith(deleted("0001", "0010"));

    assertTrue(merged.isDeleted());
    assertEquals(2, merged.reactions().total(":+1:"));
  }

  @Test
  void mergeIsDeterministicAcrossRepeatedAttempts() {
    ChatMessage stored = msg("0001");
    ChatMessage edit = edited("0001", "0005", "v2");

    ChatMessage first = stored.mergedWith(edit);
    ChatMessage second = stored.mergedWith(edit);

    assertEquals(first, second);
    assertSame(first, first.mergedWith(edit));
  }

  @Test
  void mergeRejectsDifferentSerials() {
    assertThrows(IllegalArgumentException.class, () -> msg(1).mergedWith(msg(2)));
    assertThrows(
        IllegalArgumentException.class,
        () -> msg(1).mergedWith(new ReactionSummaryEvent("0002", thumbsUp(1))));
  }

  @Test
  void reactionMergeReturnsSameInstanceWhenSummaryUnchanged() {
    ChatMessage withReactions =
        msg("0001").mergedWith(new ReactionSummaryEvent("0001", thumbsUp(1)));

    assertEquals(1, withReactions.reactions().total(":+1:"));
    assertSame(
        withReactions, withReactions.mergedWith(new ReactionSummaryEvent("0001", thumbsUp(1))));
  }
}
