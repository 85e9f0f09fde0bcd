package cafe.woden.chatwindow.model;

import org.jmolecules.ddd.annotation.ValueObject;

/** A per-message lifecycle event delivered by the realtime channel. */
@ValueObject
public record MessageEvent(MessageEventType type, ChatMessage message) {}
