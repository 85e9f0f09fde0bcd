package cafe.woden.chatwindow.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A chat message as last seen by this session.
 *
 * <p>Instances are immutable. Edits, deletions and reaction updates produce new values through
 * {@link #mergedWith(ChatMessage)} and {@link #mergedWith(ReactionSummaryEvent)}.
 */
@ValueObject
public record ChatMessage(
    String serial,
    String clientId,
    String text,
    Instant createdAt,
    Map<String, Object> metadata,
    Map<String, String> headers,
    MessageAction action,
    MessageVersion version,
    ReactionSummary reactions)
    implements Sequenced {

  public ChatMessage {
    serial = Objects.toString(serial, "").trim();
    clientId = Objects.toString(clientId, "");
    text = Objects.toString(text, "");
    if (createdAt == null) createdAt = Instant.EPOCH;
    metadata = copyOf(metadata);
    headers = copyOf(headers);
    if (action == null) action = MessageAction.CREATED;
    if (version == null) version = MessageVersion.initial(serial, createdAt, clientId);
    if (reactions == null) reactions = ReactionSummary.EMPTY;
  }

  /** A freshly created message with no edits and no reactions. */
  public static ChatMessage created(String serial, String clientId, String text, Instant at) {
    return new ChatMessage(
        serial, clientId, text, at, Map.of(), Map.of(), MessageAction.CREATED, null, null);
  }

  public boolean isUpdated() {
    return action == MessageAction.UPDATED;
  }

  public boolean isDeleted() {
    return action == MessageAction.DELETED;
  }

  @Override
  public boolean before(Sequenced other) {
    Objects.requireNonNull(other, "other");
    return SequenceOrdering.compareSerials(serial, other.serial()) < 0;
  }

  @Override
  public boolean after(Sequenced other) {
    Objects.requireNonNull(other, "other");
    return SequenceOrdering.compareSerials(serial, other.serial()) > 0;
  }

  /** Whether this is a later version of the same message than {@code other}. */
  public boolean isNewerVersionOf(ChatMessage other) {
    Objects.requireNonNull(other, "other");
    if (!serial.equals(other.serial)) {
      throw new IllegalArgumentException(
          "cannot compare versions of different messages: " + serial + " vs " + other.serial);
    }
    return version.isNewerThan(other.version);
  }

  /**
   * Combine this stored value with an incoming copy of the same message.
   *
   * <p>The newer version wins, but reactions are kept from this value since they are delivered on
   * their own channel. Returns {@code this} when {@code incoming} is not newer.
   */
  public ChatMessage mergedWith(ChatMessage incoming) {
    Objects.requireNonNull(incoming, "incoming");
    if (!incoming.isNewerVersionOf(this)) return this;
    return new ChatMessage(
        incoming.serial,
        incoming.clientId,
        incoming.text,
        incoming.createdAt,
        incoming.metadata,
        incoming.headers,
        incoming.action,
        incoming.version,
        reactions);
  }

  /** Apply a reaction summary; returns {@code this} when nothing changes. */
  public ChatMessage mergedWith(ReactionSummaryEvent event) {
    Objects.requireNonNull(event, "event");
    if (!serial.equals(event.messageSerial())) {
      throw new IllegalArgumentException(
          "reaction summary for " + event.messageSerial() + " applied to " + serial);
    }
    if (reactions.equals(event.summary())) return this;
    return new ChatMessage(
        serial, clientId, text, createdAt, metadata, headers, action, version, event.summary());
  }

  private static <V> Map<String, V> copyOf(Map<String, V> raw) {
    if (raw == null || raw.isEmpty()) return Map.of();
    LinkedHashMap<String, V> out = new LinkedHashMap<>();
    for (Map.Entry<String, V> e : raw.entrySet()) {
      if (e.getKey() == null || e.getValue() == null) continue;
      out.put(e.getKey(), e.getValue());
    }
    return Collections.unmodifiableMap(out);
  }
}
