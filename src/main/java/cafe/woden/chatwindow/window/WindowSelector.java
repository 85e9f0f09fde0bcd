package cafe.woden.chatwindow.window;

import cafe.woden.chatwindow.model.Anchor;
import cafe.woden.chatwindow.model.ChatMessage;
import cafe.woden.chatwindow.store.OrderedMessageStore;
import java.util.List;
import java.util.Objects;

/**
 * Derives the rendering window from the store's sequence and anchor, and moves the anchor.
 *
 * <p>Pure apart from anchor updates on the store; performs no I/O.
 */
public final class WindowSelector {

  private final OrderedMessageStore store;
  private final int windowSize;
  private final int overscan;

  public WindowSelector(OrderedMessageStore store, int windowSize, int overscan) {
    this.store = Objects.requireNonNull(store, "store");
    this.windowSize = Math.max(0, windowSize);
    this.overscan = Math.max(0, overscan);
  }

  /**
   * Slice of {@code sequence} around {@code anchor}: up to {@code windowSize/2 + overscan}
   * elements on each side of the anchored element.
   */
  public static WindowSlice computeWindow(
      List<ChatMessage> sequence, Anchor anchor, int windowSize, int overscan) {
    if (sequence == null || sequence.isEmpty()) return WindowSlice.empty();
    Anchor a = anchor == null ? Anchor.tail() : anchor;

    int length = sequence.size();
    int idx = a.resolve(length);
    int half = Math.max(0, windowSize) / 2;
    int pad = Math.max(0, overscan);
    int start = Math.max(0, idx - half - pad);
    int end = Math.min(length, idx + half + pad + 1);
    return new WindowSlice(sequence.subList(start, end), start, end, a.isTail());
  }

  /** Window over the store's current state; copies only the rows inside the window. */
  public WindowSlice current() {
    return computeWindow(store.view(), store.anchor(), windowSize, overscan);
  }

  public void showLatest() {
    store.setAnchor(Anchor.tail());
  }

  /**
   * Move the anchor by {@code delta} rows (positive is newer). Reaching the newest message
   * switches back to tail-follow.
   */
  public void scrollBy(int delta) {
    int size = store.size();
    if (size == 0) return;

    int latest = size - 1;
    int base = store.anchor().resolve(size);
    long next = (long) base + delta;
    if (next >= latest) {
      store.setAnchor(Anchor.tail());
    } else if (next < 0) {
      store.setAnchor(Anchor.at(0));
    } else {
      store.setAnchor(Anchor.at((int) next));
    }
  }

  /** Centre the window on {@code serial}; unknown serials leave the anchor unchanged. */
  public boolean showAround(String serial) {
    int idx = store.indexOfSerial(serial);
    if (idx < 0) return false;
    store.setAnchor(Anchor.at(idx));
    return true;
  }

  public int windowSize() {
    return windowSize;
  }

  public int overscan() {
    return overscan;
  }
}
