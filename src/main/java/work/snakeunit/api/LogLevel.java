package work.snakeunit.api;

import java.util.Locale;

/**
 * Log thresholds accepted on the command line, mapped onto the SLF4J simple binding.
 */
public enum LogLevel {
    TRACE("trace"),
    DEBUG("debug"),
    INFO("info"),
    WARN("warn"),
    ERROR("error"),
    FATAL("off");

    static final String SIMPLE_LOGGER_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    private final String simpleLoggerLevel;

    LogLevel(String simpleLoggerLevel) {
        this.simpleLoggerLevel = simpleLoggerLevel;
    }

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    public String simpleLoggerLevel() {
        return simpleLoggerLevel;
    }

    /**
     * Sets the default level of the simple binding. Only effective before the first logger is
     * created.
     */
    public void apply() {
        System.setProperty(SIMPLE_LOGGER_PROPERTY, simpleLoggerLevel);
    }
}
