package org.channelsim.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import org.slf4j.LoggerFactory;

/**
 * Applies log levels from the {@code logging} block of the configuration to Logback.
 * <pre>
 * logging {
 *   level = "WARN"
 *   loggers { "org.channelsim.runtime" = "DEBUG" }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * @param config The application configuration. A missing {@code logging} block is ignored.
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME)
                    .setLevel(Level.toLevel(config.getString("logging.level"), Level.INFO));
        }
        if (config.hasPath("logging.loggers")) {
            Config loggers = config.getConfig("logging.loggers");
            for (String name : loggers.root().keySet()) {
                context.getLogger(name).setLevel(Level.toLevel(loggers.getString(ConfigUtil.joinPath(name)), Level.INFO));
            }
        }
    }
}
