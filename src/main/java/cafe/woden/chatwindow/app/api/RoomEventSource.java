package cafe.woden.chatwindow.app.api;

import cafe.woden.chatwindow.model.MessageEvent;
import cafe.woden.chatwindow.model.ReactionSummaryEvent;
import io.reactivex.rxjava3.core.Flowable;
import java.time.Instant;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Realtime events for one room, supplied by the transport layer.
 *
 * <p>The transport already de-duplicates by serial; consumers must still tolerate re-delivery.
 */
@ApplicationLayer
public interface RoomEventSource {

  Flowable<MessageEvent> messageEvents();

  Flowable<ReactionSummaryEvent> reactionSummaries();

  /** Signalled when the transport may have missed events (for example after a reconnect). */
  Flowable<Discontinuity> discontinuities();

  record Discontinuity(Instant detectedAt, String reason) {
    public Discontinuity {
      if (detectedAt == null) detectedAt = Instant.now();
      if (reason == null) reason = "";
    }
  }
}
