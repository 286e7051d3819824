package org.pharmaguard.utils;

import com.google.common.collect.BiMap;
import com.google.common.collect.EnumHashBiMap;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;

/**
 * Logging utilities: keeps htsjdk and log4j at the verbosity requested on the command line.
 */
public final class LoggingUtils {

    private static final BiMap<Log.LogLevel, Level> LOG_LEVEL_MAP = EnumHashBiMap.create(Log.LogLevel.class);
    static {
        LOG_LEVEL_MAP.put(Log.LogLevel.DEBUG, Level.DEBUG);
        LOG_LEVEL_MAP.put(Log.LogLevel.INFO, Level.INFO);
        LOG_LEVEL_MAP.put(Log.LogLevel.WARNING, Level.WARN);
        LOG_LEVEL_MAP.put(Log.LogLevel.ERROR, Level.ERROR);
    }

    private LoggingUtils() {}

    /**
     * Propagate the verbosity level to htsjdk and log4j.
     */
    public static void setLoggingLevel(final Log.LogLevel verbosity) {
        Utils.nonNull(verbosity);
        Log.setGlobalLogLevel(verbosity);

        final LoggerContext loggerContext = (LoggerContext) LogManager.getContext(false);
        final Configuration loggerContextConfig = loggerContext.getConfiguration();
        final LoggerConfig loggerConfig = loggerContextConfig.getLoggerConfig(LoggingUtils.class.getName());
        loggerConfig.setLevel(levelToLog4jLevel(verbosity));
        loggerContext.updateLoggers();
    }

    public static Level levelToLog4jLevel(final Log.LogLevel verbosity) {
        return LOG_LEVEL_MAP.get(verbosity);
    }

    /**
     * Inverse of {@link #levelToLog4jLevel}; levels with no htsjdk counterpart map to {@code null}.
     */
    public static Log.LogLevel levelFromLog4jLevel(final Level log4jLevel) {
        return LOG_LEVEL_MAP.inverse().get(log4jLevel);
    }
}
