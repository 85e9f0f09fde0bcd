package cafe.woden.chatwindow.model;

import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Reference point of the rendering window: a concrete index into the ordered sequence, or the
 * tail-follow sentinel that always tracks the newest message.
 */
@ValueObject
public record Anchor(int index) {

  private static final int TAIL_INDEX = -1;
  private static final Anchor TAIL = new Anchor(TAIL_INDEX);

  public Anchor {
    if (index < TAIL_INDEX) index = 0;
  }

  public static Anchor tail() {
    return TAIL;
  }

  public static Anchor at(int index) {
    return new Anchor(Math.max(0, index));
  }

  public boolean isTail() {
    return index == TAIL_INDEX;
  }

  /** Concrete index for a sequence of {@code size} elements, or {@code -1} when empty. */
  public int resolve(int size) {
    if (size <= 0) return -1;
    int latest = size - 1;
    if (isTail()) return latest;
    return Math.max(0, Math.min(index, latest));
  }

  /** The same logical position after {@code count} elements were inserted in front of it. */
  public Anchor shiftedBy(int count) {
    if (isTail() || count == 0) return this;
    return at(index + count);
  }
}
