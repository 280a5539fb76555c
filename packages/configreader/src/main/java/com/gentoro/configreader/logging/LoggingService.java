package com.gentoro.configreader.logging;

import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Central place to obtain SLF4J loggers and apply level overrides from reader settings. */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply logging levels from the settings file.
   *
   * <p>Expected YAML structure: logging: level: root: INFO com.gentoro.configreader: DEBUG
   */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    Configuration levels = cfg.subset("logging.level");
    if (levels == null || levels.isEmpty()) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof ch.qos.logback.classic.LoggerContext ctx)) {
      log.debug("Logging backend is not Logback; ignoring logging.level settings");
      return;
    }

    java.util.Iterator<String> it = levels.getKeys();
    while (it.hasNext()) {
      String key = it.next();
      String lvl = levels.getString(key, null);
      if (lvl == null || lvl.isBlank()) continue;
      if ("root".equalsIgnoreCase(key)) {
        setLevel(ctx.getLogger(Logger.ROOT_LOGGER_NAME), lvl);
      } else {
        // Hierarchical keys escape dots in YAML keys by doubling them.
        setLevel(ctx.getLogger(key.replace("..", ".")), lvl);
      }
    }
  }

  private static void setLevel(ch.qos.logback.classic.Logger logger, String levelStr) {
    if (logger == null || levelStr == null) return;
    ch.qos.logback.classic.Level level =
        ch.qos.logback.classic.Level.toLevel(levelStr.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}'; ignoring for logger {}", levelStr, logger.getName());
      return;
    }
    logger.setLevel(level);
    log.debug("Set logger '{}' to level {}", logger.getName(), level);
  }
}
