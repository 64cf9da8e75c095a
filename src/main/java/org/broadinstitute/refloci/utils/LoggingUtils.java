package org.broadinstitute.refloci.utils;

import com.google.common.collect.BiMap;
import com.google.common.collect.EnumHashBiMap;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;

/**
 * Logging utilities.
 *
 * Verbosity is expressed with the htsjdk {@link Log.LogLevel} enum, as in the rest of the Broad toolchain, and
 * translated to log4j levels and to Kryo's MinLog as necessary.
 */
public final class LoggingUtils {

    /**
     * Root of all loggers of this project.
     */
    public static final String ROOT_LOGGER_NAME = "org.broadinstitute.refloci";

    private static final BiMap<Log.LogLevel, Level> loggingLevelNamespaceMap;
    static {
        loggingLevelNamespaceMap = EnumHashBiMap.create(Log.LogLevel.class);
        loggingLevelNamespaceMap.put(Log.LogLevel.ERROR, Level.ERROR);
        loggingLevelNamespaceMap.put(Log.LogLevel.WARNING, Level.WARN);
        loggingLevelNamespaceMap.put(Log.LogLevel.INFO, Level.INFO);
        loggingLevelNamespaceMap.put(Log.LogLevel.DEBUG, Level.DEBUG);
    }

    private LoggingUtils() {}

    // Package-private for unit test access
    static Log.LogLevel levelFromLog4jLevel(final Level log4jLevel) {
        return loggingLevelNamespaceMap.inverse().get(log4jLevel);
    }

    /**
     * Converts an htsjdk log level to a log4j log level.
     */
    public static Level levelToLog4jLevel(final Log.LogLevel level) {
        return loggingLevelNamespaceMap.get(Utils.nonNull(level));
    }

    /**
     * Propagate the verbosity level to htsjdk, to the project's log4j loggers and to Kryo's MinLog.
     */
    public static void setLoggingLevel(final Log.LogLevel verbosity) {
        Utils.nonNull(verbosity);
        Log.setGlobalLogLevel(verbosity);
        Configurator.setLevel(ROOT_LOGGER_NAME, levelToLog4jLevel(verbosity));
        setMinLogLoggingLevel(verbosity);
    }

    /**
     * set the logging level for {@link com.esotericsoftware.minlog.Log}, the logger used by Kryo
     */
    private static void setMinLogLoggingLevel(final Log.LogLevel verbosity) {
        switch (verbosity) {
            case DEBUG: com.esotericsoftware.minlog.Log.DEBUG(); break;
            case INFO: com.esotericsoftware.minlog.Log.INFO(); break;
            case WARNING: com.esotericsoftware.minlog.Log.WARN(); break;
            case ERROR: com.esotericsoftware.minlog.Log.ERROR(); break;
            default:
                throw new IllegalStateException("This log level is not implemented properly: " + verbosity);
        }
    }
}
