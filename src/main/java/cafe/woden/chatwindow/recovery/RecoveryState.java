package cafe.woden.chatwindow.recovery;

public enum RecoveryState {
  IDLE,
  RECOVERING
}
