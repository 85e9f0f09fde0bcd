package cafe.woden.chatwindow.config;

import cafe.woden.chatwindow.app.MessageWindowFactory;
import java.util.concurrent.ExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/** Wires the message window factory onto the shared engine executor. */
@Configuration
@Import(ExecutorConfig.class)
@EnableConfigurationProperties(MessageWindowProperties.class)
public class MessageWindowConfig {

  @Bean
  public MessageWindowFactory messageWindowFactory(
      MessageWindowProperties props,
      @Qualifier(ExecutorConfig.MESSAGE_ENGINE_EXECUTOR) ExecutorService engine) {
    return new MessageWindowFactory(props, engine);
  }
}
