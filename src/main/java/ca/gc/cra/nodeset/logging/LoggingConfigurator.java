package ca.gc.cra.nodeset.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures runtime logging for CLI-driven expansion runs.
 * <p><strong>Why:</strong> Lets operators see per-record clone counts and dropped values without editing
 * {@code logback.xml}.</p>
 * <p><strong>Role:</strong> Adapter-side utility that bridges the {@code --verbose} flag to the logging backend.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI bootstrap.</p>
 * <p><strong>Observability:</strong> Emits an SLF4J warning when dynamic configuration is unsupported.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
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
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!Level.DEBUG.equals(root.getLevel())) {
        root.setLevel(Level.DEBUG);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
