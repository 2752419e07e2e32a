package com.sysmuse.hash;

import java.io.IOException;
import java.util.logging.*;

/**
 * Centralized logging for the hashing pipeline.
 * Thin wrapper around java.util.logging configured from the "logging" section of HashConfig.
 */
public class LoggingUtil {
    public enum ConsoleOutputMode {
        ALL_TO_OUT,
        ALL_TO_ERR,
        SPLIT_SEVERE_TO_ERR
    }

    private static final Logger logger = Logger.getLogger("com.sysmuse.hash");
    private static volatile boolean initialized = false;
    // set once explicit settings have been applied; implicit defaults may still be replaced
    private static boolean configured = false;
    private static Level currentLevel = Level.INFO;
    private static String logFileName = null;
    private static ConsoleOutputMode consoleOutputMode = ConsoleOutputMode.SPLIT_SEVERE_TO_ERR;

    // Flushes after every record so progress shows up while a long run is going
    private static class FlushingHandler extends StreamHandler {
        FlushingHandler(java.io.OutputStream out, Level level) {
            super(out, new SimpleFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }

    /**
     * Configure where log messages go in console
     */
    public static void setConsoleOutputMode(ConsoleOutputMode mode) {
        consoleOutputMode = mode;
    }

    /**
     * Initialize the logging system from the hashing configuration
     */
    public static synchronized void initialize(HashConfig config) {
        initialize(config.getLoggingLevel(), config.isConsoleLoggingEnabled(),
                config.isFileLoggingEnabled(), config.getLogFileName());
    }

    /**
     * Initialize with explicit settings. Only the first call takes effect; it replaces
     * the console defaults used by messages logged before it.
     */
    public static synchronized void initialize(String levelStr, boolean consoleEnabled,
                                               boolean fileEnabled, String fileName) {
        if (configured) {
            return;
        }
        configured = true;
        configure(levelStr, consoleEnabled, fileEnabled, fileName);
    }

    private static void configure(String levelStr, boolean consoleEnabled,
                                  boolean fileEnabled, String fileName) {
        logFileName = null;
        currentLevel = parseLevel(levelStr);
        clearHandlers();

        if (consoleEnabled) {
            setupConsoleHandlers();
        }

        if (fileEnabled && fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName, true);
                fileHandler.setFormatter(new SimpleFormatter());
                fileHandler.setLevel(currentLevel);
                logger.addHandler(fileHandler);
                logFileName = fileName;
            } catch (IOException e) {
                // console is still usable, report there
                logger.log(Level.WARNING, "Failed to create log file: " + fileName, e);
            }
        }

        logger.setLevel(currentLevel);
        logger.setUseParentHandlers(false);
        initialized = true;

        info("Logging initialized: level=" + currentLevel +
                ", console=" + consoleEnabled +
                ", file=" + (logFileName != null ? logFileName : "disabled"));
    }

    static Level parseLevel(String levelStr) {
        if (levelStr == null) {
            return Level.INFO;
        }
        switch (levelStr.trim().toUpperCase()) {
            case "SEVERE":
            case "ERROR":
                return Level.SEVERE;
            case "WARNING":
            case "WARN":
                return Level.WARNING;
            case "DEBUG":
                return Level.FINE;
            case "TRACE":
                return Level.FINEST;
            default:
                return Level.INFO;
        }
    }

    private static void clearHandlers() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            handler.close();
        }
    }

    private static void setupConsoleHandlers() {
        switch (consoleOutputMode) {
            case ALL_TO_OUT:
                logger.addHandler(new FlushingHandler(System.out, currentLevel));
                break;
            case ALL_TO_ERR:
                logger.addHandler(new FlushingHandler(System.err, currentLevel));
                break;
            case SPLIT_SEVERE_TO_ERR:
                logger.addHandler(new FilteredOutHandler(currentLevel));
                logger.addHandler(new FlushingHandler(System.err, Level.SEVERE));
                break;
        }
    }

    // stdout half of SPLIT_SEVERE_TO_ERR, leaves SEVERE to the stderr handler
    private static class FilteredOutHandler extends FlushingHandler {
        FilteredOutHandler(Level level) {
            super(System.out, level);
            setFilter(record -> record.getLevel().intValue() < Level.SEVERE.intValue());
        }
    }

    public static void debug(String message) {
        ensureInitialized();
        logger.fine(message);
    }

    public static void debug(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.FINE, message, t);
    }

    public static void info(String message) {
        ensureInitialized();
        logger.info(message);
    }

    public static void warn(String message) {
        ensureInitialized();
        logger.warning(message);
    }

    public static void warn(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.WARNING, message, t);
    }

    public static void error(String message) {
        ensureInitialized();
        logger.severe(message);
    }

    public static void error(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.SEVERE, message, t);
    }

    public static boolean isDebugEnabled() {
        return currentLevel.intValue() <= Level.FINE.intValue();
    }

    private static void ensureInitialized() {
        if (!initialized) {
            initializeDefaults();
        }
    }

    private static synchronized void initializeDefaults() {
        if (!initialized) {
            configure("INFO", true, false, null);
        }
    }
}
