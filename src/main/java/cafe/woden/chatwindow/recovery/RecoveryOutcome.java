package cafe.woden.chatwindow.recovery;

/** How a discontinuity recovery pass ended. */
public enum RecoveryOutcome {
  /** The last message seen before the gap was found again; the gap is bridged. */
  FOUND,
  /** History ran out before the message was found. */
  EXHAUSTED,
  /** A fetch failed; pages integrated before the failure are kept. */
  FAILED,
  /** Not started: another pass was running, or there was nothing to recover from. */
  SKIPPED,
  /** The room changed while the pass was running; its remaining results were dropped. */
  STALE
}
