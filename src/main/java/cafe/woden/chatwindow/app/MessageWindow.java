package cafe.woden.chatwindow.app;

import cafe.woden.chatwindow.app.api.HistoryQuery;
import cafe.woden.chatwindow.app.api.RoomEventSource;
import cafe.woden.chatwindow.app.api.RoomRef;
import cafe.woden.chatwindow.app.state.RoomContext;
import cafe.woden.chatwindow.config.MessageWindowProperties;
import cafe.woden.chatwindow.history.HistoryLoader;
import cafe.woden.chatwindow.history.LoadOlderControlState;
import cafe.woden.chatwindow.history.LoadOlderResult;
import cafe.woden.chatwindow.model.ChatMessage;
import cafe.woden.chatwindow.model.MessageEvent;
import cafe.woden.chatwindow.model.ReactionSummaryEvent;
import cafe.woden.chatwindow.recovery.DiscontinuityRecoveryEngine;
import cafe.woden.chatwindow.recovery.RecoveryOutcome;
import cafe.woden.chatwindow.store.OrderedMessageStore;
import cafe.woden.chatwindow.window.WindowSelector;
import cafe.woden.chatwindow.window.WindowSlice;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.processors.BehaviorProcessor;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The message list of one mounted room, as seen by the UI.
 *
 * <p>Combines realtime events and history pages into one ordered sequence, exposes a bounded
 * window of it, and repairs gaps reported by the realtime channel. Every mutation is executed on
 * the engine executor, including events handed to the public handlers by an outside dispatcher;
 * the window snapshot and loading flags can be read from any thread.
 */
public final class MessageWindow implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(MessageWindow.class);

  private final MessageWindowProperties props;
  private final Executor engine;
  private final Scheduler engineScheduler;

  private final OrderedMessageStore store = new OrderedMessageStore();
  private final WindowSelector selector;
  private final RoomContext roomContext = new RoomContext();

  private final CompositeDisposable roomSubscriptions = new CompositeDisposable();
  private final Disposable storeSubscription;

  private final FlowableProcessor<WindowSlice> windowUpdates =
      BehaviorProcessor.createDefault(WindowSlice.empty()).toSerialized();
  private final FlowableProcessor<LoadOlderControlState> controlStates =
      BehaviorProcessor.createDefault(LoadOlderControlState.UNAVAILABLE).toSerialized();

  private volatile HistoryLoader loader;
  private volatile DiscontinuityRecoveryEngine recovery;
  private volatile WindowSlice window = WindowSlice.empty();

  public MessageWindow(MessageWindowProperties props, Executor engine) {
    this.props = props == null ? MessageWindowProperties.defaults() : props;
    this.engine = Objects.requireNonNull(engine, "engine");
    this.engineScheduler = Schedulers.from(engine);
    this.selector = new WindowSelector(store, this.props.windowSize(), this.props.overscan());
    this.storeSubscription = store.changes().subscribe(change -> recomputeWindow());
    installHistory(null);
  }

  /**
   * Mount {@code room}: drop everything held for the previous room, subscribe to the room's
   * realtime events, then start the initial history load.
   *
   * @param history may be {@code null} when the room has no history capability
   */
  public CompletableFuture<LoadOlderResult> enterRoom(
      RoomRef room, RoomEventSource events, HistoryQuery history) {
    Objects.requireNonNull(room, "room");
    Objects.requireNonNull(events, "events");
    return onEngine(
        () -> {
          teardownRoom();
          roomContext.enter(room);
          installHistory(history);
          subscribe(events);
          log.info("entered room={} history={}", room, history != null);
          return trackControlState(loader.loadInitial());
        });
  }

  /** Unmount the current room. Fetches still in flight are discarded when they complete. */
  public CompletableFuture<Void> leaveRoom() {
    return onEngine(
        () -> {
          Optional<RoomRef> previous = roomContext.room();
          teardownRoom();
          roomContext.leave();
          installHistory(null);
          previous.ifPresent(r -> log.info("left room={}", r));
          return CompletableFuture.completedFuture(null);
        });
  }

  /** Queue a realtime message event onto the engine executor. */
  public void onMessageEvent(MessageEvent event) {
    engine.execute(() -> applyMessageEvent(event));
  }

  public void onReactionSummary(ReactionSummaryEvent event) {
    engine.execute(() -> store.applyReactionSummary(event));
  }

  /**
   * Recover from a gap in the realtime stream, starting from the newest message held. Does
   * nothing when no message is held yet.
   */
  public CompletableFuture<RecoveryOutcome> onDiscontinuity() {
    return onEngine(this::recoverFromDiscontinuity);
  }

  /** Manually integrate messages, for example after sending one locally. */
  public void updateMessages(List<ChatMessage> messages) {
    updateMessages(messages, false);
  }

  public void updateMessages(List<ChatMessage> messages, boolean prepend) {
    if (messages == null || messages.isEmpty()) return;
    List<ChatMessage> batch = List.copyOf(messages);
    engine.execute(() -> store.integrate(batch, prepend));
  }

  public void showLatestMessages() {
    navigate(selector::showLatest);
  }

  /** Scroll by {@code delta} rows; positive is newer. */
  public void scrollBy(int delta) {
    navigate(() -> selector.scrollBy(delta));
  }

  public void showMessagesAroundSerial(String serial) {
    navigate(() -> selector.showAround(serial));
  }

  /** Fetch the next older history page; no-op while any history fetch is running. */
  public CompletableFuture<LoadOlderResult> loadMoreHistory() {
    return onEngine(
        () -> {
          if (recovery.isRecovering()) {
            return CompletableFuture.completedFuture(
                LoadOlderResult.notRun(loader.hasMoreHistory()));
          }
          CompletableFuture<LoadOlderResult> f = loader.loadMore();
          publishControlState();
          return trackControlState(f);
        });
  }

  public List<ChatMessage> activeMessages() {
    return window.messages();
  }

  public WindowSlice window() {
    return window;
  }

  /** Emits the current window, then every recomputed one. */
  public Flowable<WindowSlice> windowUpdates() {
    return windowUpdates.onBackpressureLatest();
  }

  public Flowable<LoadOlderControlState> historyControlStates() {
    return controlStates.onBackpressureLatest().distinctUntilChanged();
  }

  public boolean isLoading() {
    return loader.isLoading() || recovery.isRecovering();
  }

  public boolean hasMoreHistory() {
    return loader.hasMoreHistory();
  }

  public LoadOlderControlState historyControlState() {
    if (recovery.isRecovering() && loader.isAvailable()) return LoadOlderControlState.LOADING;
    return loader.controlState();
  }

  public Optional<RoomRef> room() {
    return roomContext.room();
  }

  /**
   * Copy of the whole sequence, intended for diagnostics and tests. Consistent only when read on
   * the engine executor or after one of this window's futures has completed.
   */
  public List<ChatMessage> allMessages() {
    return store.snapshot();
  }

  /**
   * Leave the current room and complete every stream. When the engine executor has already been
   * shut down the streams are completed on the calling thread instead.
   */
  @Override
  public void close() {
    try {
      leaveRoom();
      engine.execute(this::disposeStreams);
    } catch (RejectedExecutionException e) {
      log.debug("engine executor already shut down, closing window on caller thread");
      roomContext.leave();
      disposeStreams();
    }
  }

  private void disposeStreams() {
    storeSubscription.dispose();
    roomSubscriptions.dispose();
    windowUpdates.onComplete();
    controlStates.onComplete();
  }

  private void applyMessageEvent(MessageEvent event) {
    if (event == null || event.message() == null) return;
    if (event.type() == null) {
      log.error("Unknown message event type: {}", event.type());
      return;
    }
    switch (event.type()) {
      case CREATED, UPDATED, DELETED -> store.integrate(List.of(event.message()), false);
      default -> log.error("Unknown message event type: {}", event.type());
    }
  }

  private CompletableFuture<RecoveryOutcome> recoverFromDiscontinuity() {
    Optional<ChatMessage> last = store.last();
    if (last.isEmpty()) {
      log.debug("discontinuity with empty store, nothing to recover");
      return CompletableFuture.completedFuture(RecoveryOutcome.SKIPPED);
    }
    CompletableFuture<RecoveryOutcome> pass = recovery.onDiscontinuity(last.get().serial());
    publishControlState();
    return pass.whenComplete((outcome, err) -> publishControlState());
  }

  private void subscribe(RoomEventSource events) {
    roomSubscriptions.add(
        events
            .messageEvents()
            .observeOn(engineScheduler)
            .subscribe(
                this::applyMessageEvent, err -> log.warn("message event stream failed", err)));
    roomSubscriptions.add(
        events
            .reactionSummaries()
            .observeOn(engineScheduler)
            .subscribe(
                store::applyReactionSummary, err -> log.warn("reaction stream failed", err)));
    roomSubscriptions.add(
        events
            .discontinuities()
            .observeOn(engineScheduler)
            .subscribe(
                d -> {
                  log.info("discontinuity detected reason={}", d.reason());
                  recoverFromDiscontinuity();
                },
                err -> log.warn("discontinuity stream failed", err)));
  }

  private void teardownRoom() {
    roomSubscriptions.clear();
    store.clear();
    recomputeWindow();
  }

  private void installHistory(HistoryQuery history) {
    loader =
        new HistoryLoader(
            store, history, roomContext, engine, props.windowSize(), props.overscan());
    recovery =
        new DiscontinuityRecoveryEngine(
            store, history, roomContext, engine, props.historyBatchSize());
    publishControlState();
  }

  private void navigate(Runnable move) {
    engine.execute(
        () -> {
          move.run();
          recomputeWindow();
        });
  }

  private void recomputeWindow() {
    WindowSlice next = selector.current();
    window = next;
    windowUpdates.onNext(next);
  }

  private <T> CompletableFuture<T> trackControlState(CompletableFuture<T> f) {
    return f.whenComplete((ok, err) -> publishControlState());
  }

  private void publishControlState() {
    controlStates.onNext(historyControlState());
  }

  private <T> CompletableFuture<T> onEngine(Supplier<CompletableFuture<T>> task) {
    CompletableFuture<T> out = new CompletableFuture<>();
    engine.execute(
        () -> {
          try {
            task.get()
                .whenComplete(
                    (ok, err) -> {
                      if (err != null) {
                        out.completeExceptionally(err);
                      } else {
                        out.complete(ok);
                      }
                    });
          } catch (RuntimeException e) {
            out.completeExceptionally(e);
          }
        });
    return out;
  }
}
