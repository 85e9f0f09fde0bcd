package cafe.woden.chatwindow.recovery;

import cafe.woden.chatwindow.app.api.HistoryPage;
import cafe.woden.chatwindow.app.api.HistoryQuery;
import cafe.woden.chatwindow.app.state.RoomContext;
import cafe.woden.chatwindow.history.HistoryPages;
import cafe.woden.chatwindow.model.SequenceOrdering;
import cafe.woden.chatwindow.store.OrderedMessageStore;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges gaps in the realtime stream by walking history backwards until the last message seen
 * before the gap shows up again.
 *
 * <p>Only one pass runs at a time; signals arriving during a pass are dropped. The pass always
 * returns the engine to {@link RecoveryState#IDLE}, whatever way it ends.
 */
public final class DiscontinuityRecoveryEngine {

  private static final Logger log = LoggerFactory.getLogger(DiscontinuityRecoveryEngine.class);

  private final OrderedMessageStore store;
  private final HistoryQuery history;
  private final RoomContext room;
  private final Executor engine;
  private final int pageSize;

  private volatile RecoveryState state = RecoveryState.IDLE;

  public DiscontinuityRecoveryEngine(
      OrderedMessageStore store,
      HistoryQuery history,
      RoomContext room,
      Executor engine,
      int pageSize) {
    this.store = Objects.requireNonNull(store, "store");
    this.history = history;
    this.room = Objects.requireNonNull(room, "room");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.pageSize = Math.max(1, pageSize);
  }

  /**
   * Start a recovery pass for a gap after {@code lostSerial}. Must be called on the engine
   * executor.
   */
  public CompletableFuture<RecoveryOutcome> onDiscontinuity(String lostSerial) {
    if (state == RecoveryState.RECOVERING) {
      log.debug("discontinuity ignored, recovery already running");
      return CompletableFuture.completedFuture(RecoveryOutcome.SKIPPED);
    }
    if (history == null || lostSerial == null || lostSerial.isBlank()) {
      return CompletableFuture.completedFuture(RecoveryOutcome.SKIPPED);
    }

    state = RecoveryState.RECOVERING;
    final long gen = room.generation();
    log.info(
        "discontinuity recovery start room={} lostSerial={}",
        room.room().orElse(null),
        lostSerial);

    CompletableFuture<RecoveryOutcome> result = new CompletableFuture<>();
    try {
      HistoryPages.fetch(() -> history.query(pageSize))
          .whenCompleteAsync((page, err) -> onPage(gen, lostSerial, 1, page, err, result), engine);
    } catch (RuntimeException e) {
      // The engine executor rejected the continuation (shutdown).
      log.warn("Discontinuity recovery failed", e);
      finish(result, RecoveryOutcome.FAILED, lostSerial, 0);
    }
    return result;
  }

  private void onPage(
      long gen,
      String lostSerial,
      int pageNo,
      HistoryPage page,
      Throwable err,
      CompletableFuture<RecoveryOutcome> result) {
    try {
      if (!room.isCurrent(gen)) {
        finish(result, RecoveryOutcome.STALE, lostSerial, pageNo);
        return;
      }
      if (err != null) {
        log.warn("Discontinuity recovery failed", HistoryPages.unwrap(err));
        finish(result, RecoveryOutcome.FAILED, lostSerial, pageNo);
        return;
      }
      if (page == null) {
        finish(result, RecoveryOutcome.EXHAUSTED, lostSerial, pageNo);
        return;
      }

      // Pages may straddle messages already held, so let the store place each one.
      store.integrate(HistoryPages.oldestFirst(page), false);

      if (SequenceOrdering.indexOfSerial(page.items(), lostSerial, true) >= 0) {
        finish(result, RecoveryOutcome.FOUND, lostSerial, pageNo);
        return;
      }
      if (!page.hasNext()) {
        finish(result, RecoveryOutcome.EXHAUSTED, lostSerial, pageNo);
        return;
      }

      HistoryPages.fetch(page::next)
          .whenCompleteAsync(
              (next, nextErr) -> onPage(gen, lostSerial, pageNo + 1, next, nextErr, result),
              engine);
    } catch (RuntimeException e) {
      log.warn("Discontinuity recovery failed", e);
      finish(result, RecoveryOutcome.FAILED, lostSerial, pageNo);
    }
  }

  private void finish(
      CompletableFuture<RecoveryOutcome> result,
      RecoveryOutcome outcome,
      String lostSerial,
      int pages) {
    state = RecoveryState.IDLE;
    log.info(
        "discontinuity recovery end outcome={} lostSerial={} pages={}", outcome, lostSerial, pages);
    result.complete(outcome);
  }

  public RecoveryState state() {
    return state;
  }

  public boolean isRecovering() {
    return state == RecoveryState.RECOVERING;
  }
}
