package cafe.woden.chatwindow.history;

import cafe.woden.chatwindow.app.api.HistoryPage;
import cafe.woden.chatwindow.app.api.HistoryQuery;
import cafe.woden.chatwindow.app.state.RoomContext;
import cafe.woden.chatwindow.model.ChatMessage;
import cafe.woden.chatwindow.store.OrderedMessageStore;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls backward-paginated history pages into the store for the mounted room.
 *
 * <p>All methods must be called on the engine executor; completions hop back onto it before
 * touching any state. {@link #isLoading()} and {@link #hasMoreHistory()} may be read from any
 * thread.
 */
public final class HistoryLoader {

  private static final Logger log = LoggerFactory.getLogger(HistoryLoader.class);

  private final OrderedMessageStore store;
  private final HistoryQuery history;
  private final RoomContext room;
  private final Executor engine;
  private final int initialPageSize;

  private HistoryPage cursor;
  private boolean initialLoadAttempted;
  private volatile boolean loading;
  private volatile boolean hasMore;

  public HistoryLoader(
      OrderedMessageStore store,
      HistoryQuery history,
      RoomContext room,
      Executor engine,
      int windowSize,
      int overscan) {
    this.store = Objects.requireNonNull(store, "store");
    this.history = history;
    this.room = Objects.requireNonNull(room, "room");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.initialPageSize = Math.max(1, windowSize + 2 * Math.max(0, overscan));
    // Until the first page says otherwise, assume history exists whenever it can be queried.
    this.hasMore = history != null;
  }

  /**
   * Fetch the most recent page, sized to fill the window plus overscan on both sides.
   *
   * <p>Runs at most once per room; a failed attempt re-arms so a later trigger can retry.
   */
  public CompletableFuture<LoadOlderResult> loadInitial() {
    if (history == null || initialLoadAttempted) {
      return CompletableFuture.completedFuture(LoadOlderResult.notRun(hasMore));
    }

    initialLoadAttempted = true;
    loading = true;
    final long gen = room.generation();
    log.debug("initial history load room={} limit={}", room.room().orElse(null), initialPageSize);

    return HistoryPages.fetch(() -> history.query(initialPageSize))
        .handleAsync(
            (page, err) -> {
              try {
                if (!room.isCurrent(gen)) {
                  initialLoadAttempted = false;
                  log.debug("dropping initial history page for stale room generation {}", gen);
                  return LoadOlderResult.notRun(hasMore);
                }
                if (err != null) {
                  initialLoadAttempted = false;
                  log.warn("History load failed", HistoryPages.unwrap(err));
                  return LoadOlderResult.notRun(hasMore);
                }
                return applyPage(page);
              } catch (RuntimeException e) {
                initialLoadAttempted = false;
                log.warn("History load failed", e);
                return LoadOlderResult.notRun(hasMore);
              } finally {
                loading = false;
              }
            },
            engine);
  }

  /**
   * Fetch the next older page. Does nothing while a load is running, when history is exhausted,
   * or when no continuation is held.
   */
  public CompletableFuture<LoadOlderResult> loadMore() {
    if (loading || !hasMore || cursor == null) {
      log.debug(
          "load more skipped loading={} hasMore={} cursor={}", loading, hasMore, cursor != null);
      return CompletableFuture.completedFuture(LoadOlderResult.notRun(hasMore));
    }

    loading = true;
    final long gen = room.generation();
    final HistoryPage from = cursor;

    return HistoryPages.fetch(from::next)
        .handleAsync(
            (page, err) -> {
              try {
                if (!room.isCurrent(gen)) {
                  log.debug("dropping older history page for stale room generation {}", gen);
                  return LoadOlderResult.notRun(hasMore);
                }
                if (err != null) {
                  log.warn("History load failed", HistoryPages.unwrap(err));
                  return LoadOlderResult.notRun(hasMore);
                }
                if (page == null) {
                  cursor = null;
                  hasMore = false;
                  return new LoadOlderResult(List.of(), false, false, true);
                }
                return applyPage(page);
              } catch (RuntimeException e) {
                log.warn("History load failed", e);
                return LoadOlderResult.notRun(hasMore);
              } finally {
                loading = false;
              }
            },
            engine);
  }

  private LoadOlderResult applyPage(HistoryPage page) {
    if (page == null) {
      throw new IllegalStateException("history source completed without a page");
    }
    List<ChatMessage> oldestFirst = HistoryPages.oldestFirst(page);
    if (oldestFirst.isEmpty()) {
      log.debug("history page for room={} was empty", room.room().orElse(null));
    }
    boolean changed = store.integrate(oldestFirst, true);

    boolean next = page.hasNext();
    cursor = next ? page : null;
    hasMore = next;
    return new LoadOlderResult(oldestFirst, changed, next, true);
  }

  /** Forget cursors and latches; the next {@link #loadInitial()} starts from scratch. */
  public void reset() {
    cursor = null;
    initialLoadAttempted = false;
    loading = false;
    hasMore = history != null;
  }

  public boolean isLoading() {
    return loading;
  }

  public boolean hasMoreHistory() {
    return hasMore;
  }

  public boolean isAvailable() {
    return history != null;
  }

  public boolean initialLoadAttempted() {
    return initialLoadAttempted;
  }

  public int initialPageSize() {
    return initialPageSize;
  }

  public LoadOlderControlState controlState() {
    if (history == null) return LoadOlderControlState.UNAVAILABLE;
    if (loading) return LoadOlderControlState.LOADING;
    if (!hasMore) return LoadOlderControlState.EXHAUSTED;
    return LoadOlderControlState.READY;
  }
}
