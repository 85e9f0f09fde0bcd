package cafe.woden.chatwindow.app.state;

import cafe.woden.chatwindow.app.api.RoomRef;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks which room is mounted and a generation number that changes with every room switch.
 *
 * <p>Asynchronous work captures {@link #generation()} when it starts and checks {@link
 * #isCurrent(long)} before applying its result, so results that arrive after a room switch are
 * dropped instead of applied.
 */
public final class RoomContext {

  private final AtomicLong generation = new AtomicLong(0);
  private volatile RoomRef room;

  /** Switch to {@code next} (or to no room); returns the new generation. */
  public long enter(RoomRef next) {
    this.room = next;
    return generation.incrementAndGet();
  }

  public long leave() {
    return enter(null);
  }

  public long generation() {
    return generation.get();
  }

  public boolean isCurrent(long observedGeneration) {
    return generation.get() == observedGeneration && room != null;
  }

  public Optional<RoomRef> room() {
    return Optional.ofNullable(room);
  }
}
