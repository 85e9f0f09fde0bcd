package cafe.woden.chatwindow.config;

import cafe.woden.chatwindow.util.DaemonThreads;
import java.util.concurrent.ExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * App-owned executors.
 *
 * <p>The message engine runs on exactly one thread: every store mutation, anchor move and history
 * continuation is serialized through it.
 */
@Configuration
public class ExecutorConfig {
  public static final String MESSAGE_ENGINE_EXECUTOR = "messageEngineExecutor";

  @Bean(name = MESSAGE_ENGINE_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService messageEngineExecutor() {
    return DaemonThreads.newSingleThreadExecutor("chatwindow-engine");
  }
}
