package org.seisview.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

/**
 * Applies log levels from configuration to Logback.
 * <pre>
 * logging {
 *   default-level = "INFO"
 *   levels {
 *     "org.seisview.segy" = "DEBUG"
 *     "io.javalin" = "WARN"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * @param config the root configuration; {@code logging} is read if present
     */
    public static void configure(final Config config) {
        if (!config.hasPath("logging")) {
            return;
        }
        final Config logging = config.getConfig("logging");

        if (logging.hasPath("default-level")) {
            rootLogger().setLevel(Level.toLevel(logging.getString("default-level"), Level.INFO));
        }

        if (logging.hasPath("levels")) {
            for (Map.Entry<String, ConfigValue> entry : logging.getObject("levels").entrySet()) {
                final String loggerName = entry.getKey().replace("\"", "");
                final Level level = Level.toLevel(String.valueOf(entry.getValue().unwrapped()), null);
                if (level == null) {
                    rootLogger().warn("Ignoring unknown log level '{}' for logger {}",
                        entry.getValue().unwrapped(), loggerName);
                    continue;
                }
                ((Logger) LoggerFactory.getLogger(loggerName)).setLevel(level);
            }
        }
    }

    private static Logger rootLogger() {
        return (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }
}
