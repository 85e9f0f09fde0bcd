package cafe.woden.chatwindow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sizing of the rendering window and history pages.
 *
 * <p>Missing or out-of-range values fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "chatwindow.window")
public record MessageWindowProperties(
    /** Rows kept mounted, excluding overscan. Default: 200. */
    Integer windowSize,

    /** Extra rows rendered above and below the window. Default: 20. */
    Integer overscan,

    /** Messages requested per page during discontinuity recovery. Default: 300. */
    Integer historyBatchSize
) {

  public static final int DEFAULT_WINDOW_SIZE = 200;
  public static final int DEFAULT_OVERSCAN = 20;
  public static final int DEFAULT_HISTORY_BATCH_SIZE = 300;

  public MessageWindowProperties {
    if (windowSize == null || windowSize <= 0) windowSize = DEFAULT_WINDOW_SIZE;
    if (overscan == null || overscan < 0) overscan = DEFAULT_OVERSCAN;
    if (historyBatchSize == null || historyBatchSize <= 0) {
      historyBatchSize = DEFAULT_HISTORY_BATCH_SIZE;
    }
  }

  public static MessageWindowProperties defaults() {
    return new MessageWindowProperties(null, null, null);
  }
}
