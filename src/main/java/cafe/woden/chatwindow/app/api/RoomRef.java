package cafe.woden.chatwindow.app.api;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Identifies the room whose message stream is currently mounted.
 *
 * <p>Room ids are case-sensitive; surrounding whitespace is dropped.
 */
@ValueObject
public final class RoomRef {

  private final String roomId;

  public RoomRef(String roomId) {
    this.roomId = Objects.toString(roomId, "").trim();
    if (this.roomId.isEmpty()) throw new IllegalArgumentException("roomId must not be blank");
  }

  public String roomId() {
    return roomId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RoomRef other)) return false;
    return roomId.equals(other.roomId);
  }

  @Override
  public int hashCode() {
    return roomId.hashCode();
  }

  @Override
  public String toString() {
    return "RoomRef{" + roomId + "}";
  }
}
