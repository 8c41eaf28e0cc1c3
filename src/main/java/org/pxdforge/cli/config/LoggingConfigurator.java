package org.pxdforge.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies the log levels of the {@code logging} section to Logback.
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels { "org.pxdforge.generator.PxdGenerator" = "INFO" }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final String DEFAULT_LEVEL = "logging.default-level";
    private static final String LEVELS = "logging.levels";

    private LoggingConfigurator() {
    }

    /**
     * @param config The application config. Missing sections leave Logback untouched.
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath(DEFAULT_LEVEL)) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                    .setLevel(Level.toLevel(config.getString(DEFAULT_LEVEL), Level.WARN));
        }
        if (config.hasPath(LEVELS)) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject(LEVELS).entrySet()) {
                Logger logger = context.getLogger(entry.getKey());
                logger.setLevel(Level.toLevel(String.valueOf(entry.getValue().unwrapped()), Level.INFO));
            }
        }
    }
}
