package cafe.woden.chatwindow.app.api;

import cafe.woden.chatwindow.model.ChatMessage;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.jmolecules.architecture.layered.ApplicationLayer;

/** One page of backward-paginated history. */
@ApplicationLayer
public interface HistoryPage {

  /** Messages in this page, newest first. */
  List<ChatMessage> items();

  /** Whether an older page is available. */
  boolean hasNext();

  /**
   * Fetch the next older page. May complete with {@code null} when the source turns out to have
   * nothing further.
   */
  CompletableFuture<HistoryPage> next();
}
