package ca.gc.cra.hostlink.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures HOSTLINK runtime logging for the CLI.
 * <p><strong>Why:</strong> Operators raise verbosity with {@code --verbose} instead of editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  /**
   * Sets the root logger level, e.g. from the {@code logLevel} configuration key.
   *
   * @param levelName Logback level name such as {@code INFO} or {@code WARN}; case-insensitive
   * @throws IllegalArgumentException if the name is not a Logback level
   */
  public static void applyLevel(String levelName) {
    if (levelName == null || levelName.isBlank()) {
      return;
    }
    Level level = Level.toLevel(levelName.trim(), null);
    if (level == null) {
      throw new IllegalArgumentException("logLevel must be one of TRACE, DEBUG, INFO, WARN, ERROR, OFF (was "
          + levelName + ")");
    }
    setRootLevel(level);
  }

  private static void setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("Log level change to {} requested but backend {} does not support dynamic level updates", level,
        factory.getClass().getName());
  }
}
