package cafe.woden.chatwindow.model;

/** Lifecycle state carried by the latest known version of a message. */
public enum MessageAction {
  CREATED,
  UPDATED,
  DELETED
}
