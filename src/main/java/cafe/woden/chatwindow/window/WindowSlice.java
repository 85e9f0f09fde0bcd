package cafe.woden.chatwindow.window;

import cafe.woden.chatwindow.model.ChatMessage;
import java.util.List;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Contiguous part of the ordered sequence exposed for rendering.
 *
 * <p>{@code endIndex} is exclusive.
 */
@ValueObject
public record WindowSlice(
    List<ChatMessage> messages, int startIndex, int endIndex, boolean tailFollowing) {

  private static final WindowSlice EMPTY = new WindowSlice(List.of(), 0, 0, true);

  public WindowSlice {
    messages = messages == null ? List.of() : List.copyOf(messages);
    if (startIndex < 0) startIndex = 0;
    if (endIndex < startIndex) endIndex = startIndex;
  }

  public static WindowSlice empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return messages.isEmpty();
  }

  public int size() {
    return messages.size();
  }
}
