package cafe.woden.chatwindow.history;

/** UI-neutral state for a "load older messages" control. */
public enum LoadOlderControlState {
  READY,
  LOADING,
  EXHAUSTED,
  UNAVAILABLE
}
