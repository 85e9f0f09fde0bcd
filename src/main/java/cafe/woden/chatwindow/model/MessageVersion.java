package cafe.woden.chatwindow.model;

import java.time.Instant;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Version stamp of a message. The original post carries a version whose serial equals the message
 * serial; every edit or delete issues a greater one.
 */
@ValueObject
public record MessageVersion(
    String serial, Instant timestamp, String clientId, String description) {

  public MessageVersion {
    serial = Objects.toString(serial, "").trim();
    if (timestamp == null) timestamp = Instant.EPOCH;
    clientId = Objects.toString(clientId, "");
    description = Objects.toString(description, "");
  }

  public static MessageVersion initial(String messageSerial, Instant at, String clientId) {
    return new MessageVersion(messageSerial, at, clientId, "");
  }

  public boolean isNewerThan(MessageVersion other) {
    if (other == null) return true;
    return SequenceOrdering.compareSerials(serial, other.serial) > 0;
  }
}
