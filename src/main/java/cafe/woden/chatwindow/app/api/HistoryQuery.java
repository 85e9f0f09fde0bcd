package cafe.woden.chatwindow.app.api;

import java.util.concurrent.CompletableFuture;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Backward-paginated history for one room, starting at the point where the realtime subscription
 * was attached.
 */
@ApplicationLayer
public interface HistoryQuery {

  /** Fetch the most recent page of at most {@code limit} messages. */
  CompletableFuture<HistoryPage> query(int limit);
}
