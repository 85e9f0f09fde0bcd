package cafe.woden.chatwindow.history;

import cafe.woden.chatwindow.app.api.HistoryPage;
import cafe.woden.chatwindow.model.ChatMessage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/** Helpers shared by the history loader and discontinuity recovery. */
public final class HistoryPages {

  private HistoryPages() {}

  /** Page items converted from newest-first to oldest-first. */
  public static List<ChatMessage> oldestFirst(HistoryPage page) {
    if (page == null) return List.of();
    List<ChatMessage> items = page.items();
    if (items == null || items.isEmpty()) return List.of();
    ArrayList<ChatMessage> out = new ArrayList<>(items);
    Collections.reverse(out);
    return out;
  }

  /**
   * Invoke a fetch, turning a synchronous throw or a {@code null} future into a failed future so
   * every failure reaches the same completion handler.
   */
  public static CompletableFuture<HistoryPage> fetch(
      Supplier<CompletableFuture<HistoryPage>> call) {
    try {
      CompletableFuture<HistoryPage> f = call.get();
      if (f == null) {
        return CompletableFuture.failedFuture(
            new IllegalStateException("history source returned no future"));
      }
      return f;
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /** Strip the wrappers {@link CompletableFuture} puts around the real failure. */
  public static Throwable unwrap(Throwable err) {
    Throwable t = err;
    while ((t instanceof CompletionException || t instanceof ExecutionException)
        && t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }
}
