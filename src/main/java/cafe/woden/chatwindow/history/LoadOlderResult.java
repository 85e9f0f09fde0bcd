package cafe.woden.chatwindow.history;

import cafe.woden.chatwindow.model.ChatMessage;
import java.util.List;

/** Result of an initial history load or a "load older messages" request. */
public record LoadOlderResult(
    /** Messages returned, in chronological order (oldest-first). */
    List<ChatMessage> messagesOldestFirst,

    /** Whether integrating them changed the store. */
    boolean changed,

    /** Whether there are still older pages available. */
    boolean hasMore,

    /** False when the request was rejected, failed, or arrived after a room switch. */
    boolean completed
) {
  public LoadOlderResult {
    messagesOldestFirst =
        messagesOldestFirst == null ? List.of() : List.copyOf(messagesOldestFirst);
  }

  public static LoadOlderResult notRun(boolean hasMore) {
    return new LoadOlderResult(List.of(), false, hasMore, false);
  }
}
