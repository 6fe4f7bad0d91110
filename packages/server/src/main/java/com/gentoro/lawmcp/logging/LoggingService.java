package com.gentoro.lawmcp.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger lookup plus the {@code logging.level.*} overrides of {@code application.yaml}.
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.lawmcp.citation: DEBUG
 *     okhttp3: WARN
 * </pre>
 *
 * Logger names contain dots, which the YAML configuration reports escaped as {@code ..}; they are
 * unescaped before the level is set.
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  static final String PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Sets the configured levels on the Logback context.
   *
   * @return logger name to level for every override applied, in configuration order
   */
  public static Map<String, Level> applyConfiguration(Configuration cfg) {
    Map<String, Level> applied = new LinkedHashMap<>();
    if (cfg == null) {
      return applied;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext ctx)) {
      log.warn("Logging backend is {}, ignoring {}.*", factory.getClass().getName(), PREFIX);
      return applied;
    }

    Configuration levels = cfg.subset(PREFIX);
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      String name = key.replace("..", ".");
      Level level = Level.toLevel(levels.getString(key, "").trim(), null);
      if (level == null) {
        log.warn("Unknown log level '{}' for {}", levels.getString(key), name);
        continue;
      }
      String loggerName = "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name;
      ctx.getLogger(loggerName).setLevel(level);
      applied.put(loggerName, level);
    }
    if (!applied.isEmpty()) {
      log.debug("Applied log levels {}", applied);
    }
    return applied;
  }
}
