package cafe.woden.chatwindow.model;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** Latest reaction totals for one message, keyed by the target message serial. */
@ValueObject
public record ReactionSummaryEvent(String messageSerial, ReactionSummary summary) {
  public ReactionSummaryEvent {
    messageSerial = Objects.toString(messageSerial, "").trim();
    if (summary == null) summary = ReactionSummary.EMPTY;
  }
}
