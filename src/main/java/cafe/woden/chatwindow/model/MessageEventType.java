package cafe.woden.chatwindow.model;

public enum MessageEventType {
  CREATED,
  UPDATED,
  DELETED
}
