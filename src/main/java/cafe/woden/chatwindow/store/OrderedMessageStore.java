package cafe.woden.chatwindow.store;

import cafe.woden.chatwindow.model.Anchor;
import cafe.woden.chatwindow.model.ChatMessage;
import cafe.woden.chatwindow.model.ReactionSummaryEvent;
import cafe.woden.chatwindow.model.SequenceOrdering;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the full, strictly ordered sequence of known messages for one room.
 *
 * <p>Single writer: every mutating call must come from the same logical thread (the engine
 * executor). A batch is applied in one call, together with the anchor and serial-index updates it
 * implies, so readers never see a partially applied batch.
 */
public final class OrderedMessageStore {

  private static final Logger log = LoggerFactory.getLogger(OrderedMessageStore.class);

  /** Emitted after every mutation that changed the sequence. */
  public record StoreChange(long version, int size) {}

  private final ArrayList<ChatMessage> sequence = new ArrayList<>();
  private final List<ChatMessage> readOnly = Collections.unmodifiableList(sequence);
  private final Set<String> serials = new HashSet<>();
  private Anchor anchor = Anchor.tail();
  private long version;

  private final FlowableProcessor<StoreChange> changes =
      PublishProcessor.<StoreChange>create().toSerialized();

  public Flowable<StoreChange> changes() {
    return changes.onBackpressureBuffer();
  }

  /**
   * Merge a batch of messages into the sequence.
   *
   * @param prepend hint that the batch is older than everything held, enabling head insertion
   * @return whether the sequence changed
   */
  public boolean integrate(List<ChatMessage> batch, boolean prepend) {
    if (batch == null || batch.isEmpty()) return false;

    boolean changed = false;
    int insertedBeforeAnchor = 0;

    for (ChatMessage m : batch) {
      if (m == null || m.serial().isEmpty()) {
        log.debug("skipping message without serial");
        continue;
      }

      if (serials.contains(m.serial())) {
        int idx = SequenceOrdering.indexOfSerial(sequence, m.serial(), false);
        if (idx < 0) continue;
        ChatMessage existing = sequence.get(idx);
        ChatMessage merged = existing.mergedWith(m);
        if (merged != existing && !merged.equals(existing)) {
          sequence.set(idx, merged);
          changed = true;
        }
        continue;
      }

      int anchorIdx = anchor.isTail() ? -1 : anchor.index() + insertedBeforeAnchor;
      if (prepend && (sequence.isEmpty() || m.before(sequence.get(0)))) {
        sequence.add(0, m);
        if (anchorIdx >= 0) insertedBeforeAnchor++;
      } else if (sequence.isEmpty() || m.after(sequence.get(sequence.size() - 1))) {
        sequence.add(m);
      } else {
        int insIdx = SequenceOrdering.insertionIndex(sequence, m);
        sequence.add(insIdx, m);
        if (anchorIdx >= 0 && insIdx <= anchorIdx) insertedBeforeAnchor++;
      }

      serials.add(m.serial());
      changed = true;
    }

    if (!changed) return false;

    anchor = anchor.shiftedBy(insertedBeforeAnchor);
    publish();
    return true;
  }

  /**
   * Attach a reaction summary to the message it targets.
   *
   * <p>Summaries for messages this store has not seen are dropped; a later history fetch carries
   * the current reaction state anyway.
   */
  public boolean applyReactionSummary(ReactionSummaryEvent event) {
    if (event == null || !serials.contains(event.messageSerial())) return false;

    int idx = SequenceOrdering.indexOfSerial(sequence, event.messageSerial(), false);
    if (idx < 0) return false;

    ChatMessage existing = sequence.get(idx);
    ChatMessage merged = existing.mergedWith(event);
    if (merged == existing) return false;

    sequence.set(idx, merged);
    publish();
    return true;
  }

  /** Drop every message and reset the anchor to tail-follow. */
  public void clear() {
    boolean hadContent = !sequence.isEmpty() || !anchor.isTail();
    sequence.clear();
    serials.clear();
    anchor = Anchor.tail();
    if (hadContent) publish();
  }

  public int indexOfSerial(String serial) {
    if (serial == null || !serials.contains(serial)) return -1;
    return SequenceOrdering.indexOfSerial(sequence, serial, false);
  }

  public boolean contains(String serial) {
    return serial != null && serials.contains(serial);
  }

  public Optional<ChatMessage> first() {
    return sequence.isEmpty() ? Optional.empty() : Optional.of(sequence.get(0));
  }

  public Optional<ChatMessage> last() {
    return sequence.isEmpty() ? Optional.empty() : Optional.of(sequence.get(sequence.size() - 1));
  }

  /**
   * Live read-only view of the sequence, oldest first. Only valid on the engine executor; callers
   * copy the part they keep.
   */
  public List<ChatMessage> view() {
    return readOnly;
  }

  /** Immutable copy of the current sequence, oldest first. */
  public List<ChatMessage> snapshot() {
    return List.copyOf(sequence);
  }

  public int size() {
    return sequence.size();
  }

  public boolean isEmpty() {
    return sequence.isEmpty();
  }

  public Anchor anchor() {
    return anchor;
  }

  public void setAnchor(Anchor anchor) {
    this.anchor = Objects.requireNonNull(anchor, "anchor");
  }

  /** Incremented after every change; used to decide whether derived views are stale. */
  public long version() {
    return version;
  }

  private void publish() {
    version++;
    changes.onNext(new StoreChange(version, sequence.size()));
  }
}
