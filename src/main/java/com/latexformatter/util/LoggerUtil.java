package com.latexformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.*;

/**
 * Utility class for configuring and managing logging throughout the formatter.
 * Console output follows the bundled logging.properties; a log file is only written
 * when one is requested with {@link #setLogFile(Path)}.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.INFO;
    private static FileHandler logFileHandler;

    /**
     * Initializes the logging system, preferring the bundled logging.properties.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try {
            try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
                if (is != null) {
                    LogManager.getLogManager().readConfiguration(is);
                    initialized = true;
                    return;
                }
            }

            configureBasicLogging();
            initialized = true;
        } catch (IOException | SecurityException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
            e.printStackTrace();
        }
    }

    /**
     * Console-only logging, used when logging.properties is not on the classpath.
     */
    private static void configureBasicLogging() {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(consoleLevel);
        consoleHandler.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(Level.INFO);
    }

    /**
     * Sets the console logging level.
     */
    public static synchronized void setConsoleLevel(Level level) {
        consoleLevel = level;

        if (!initialized) {
            initialize();
        }
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
        if (rootLogger.getLevel() == null || rootLogger.getLevel().intValue() > level.intValue()) {
            rootLogger.setLevel(level);
        }
    }

    /**
     * Appends all log records to {@code path}, replacing the log file set before.
     *
     * @throws IOException if the file cannot be opened
     */
    public static synchronized void setLogFile(Path path) throws IOException {
        if (!initialized) {
            initialize();
        }
        FileHandler fileHandler = new FileHandler(path.toString(), true);
        fileHandler.setLevel(Level.ALL);
        fileHandler.setFormatter(new SimpleFormatter());

        closeLogFile();
        rootLogger.addHandler(fileHandler);
        logFileHandler = fileHandler;
    }

    /**
     * Detaches and closes the log file, if one is set.
     */
    public static synchronized void closeLogFile() {
        if (logFileHandler != null) {
            rootLogger.removeHandler(logFileHandler);
            logFileHandler.close();
            logFileHandler = null;
        }
    }

    /**
     * Gets a logger for a specific class.
     */
    public static Logger getLogger(Class<?> clazz) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Gets a logger for a specific name.
     */
    public static Logger getLogger(String name) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(name);
    }

    /**
     * Flushes and closes all handlers.
     */
    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.flush();
            handler.close();
        }
    }
}
