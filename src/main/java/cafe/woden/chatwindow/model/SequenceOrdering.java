package cafe.woden.chatwindow.model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/** Search helpers over lists kept sorted by {@link Sequenced} order. */
public final class SequenceOrdering {

  private static final Comparator<Sequenced> THREE_WAY =
      (a, b) -> {
        if (a.before(b)) return -1;
        if (a.after(b)) return 1;
        return 0;
      };

  private SequenceOrdering() {}

  /** Comparator derived from the {@code before}/{@code after} predicates. */
  public static <T extends Sequenced> Comparator<T> threeWay() {
    return THREE_WAY::compare;
  }

  /** Lexicographic serial comparison used by the chat service's serial format. */
  public static int compareSerials(String a, String b) {
    return Objects.toString(a, "").compareTo(Objects.toString(b, ""));
  }

  /**
   * Binary search by serial.
   *
   * @param reverse {@code true} when {@code items} is sorted newest-first (history page order)
   * @return the index, or {@code -1} when absent
   */
  public static int indexOfSerial(List<? extends Sequenced> items, String serial, boolean reverse) {
    if (items == null || items.isEmpty() || serial == null) return -1;

    int left = 0;
    int right = items.size() - 1;
    while (left <= right) {
      int mid = (left + right) >>> 1;
      Sequenced m = items.get(mid);
      if (m == null) return -1;

      int cmp = compareSerials(m.serial(), serial);
      if (cmp == 0) return mid;

      boolean goRight = reverse ? cmp > 0 : cmp < 0;
      if (goRight) {
        left = mid + 1;
      } else {
        right = mid - 1;
      }
    }
    return -1;
  }

  /**
   * First index whose element {@code item} sorts before under {@link #threeWay()}; {@code
   * items.size()} if none.
   */
  public static int insertionIndex(List<? extends Sequenced> items, Sequenced item) {
    int left = 0;
    int right = items.size();
    while (left < right) {
      int mid = (left + right) >>> 1;
      if (THREE_WAY.compare(item, items.get(mid)) < 0) {
        right = mid;
      } else {
        left = mid + 1;
      }
    }
    return left;
  }
}
