package cafe.woden.chatwindow.app;

import cafe.woden.chatwindow.config.MessageWindowProperties;
import java.util.Objects;
import java.util.concurrent.Executor;

/** Creates {@link MessageWindow}s that share one engine executor and one set of sizing options. */
public final class MessageWindowFactory {

  private final MessageWindowProperties props;
  private final Executor engine;

  public MessageWindowFactory(MessageWindowProperties props, Executor engine) {
    this.props = props == null ? MessageWindowProperties.defaults() : props;
    this.engine = Objects.requireNonNull(engine, "engine");
  }

  public MessageWindow create() {
    return new MessageWindow(props, engine);
  }

  public MessageWindowProperties properties() {
    return props;
  }
}
