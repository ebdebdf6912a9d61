package co.elastic.policycheck.cli;

import java.util.Locale;

/**
 * Log thresholds accepted by {@code --log-level}, applied to the slf4j-simple backend.
 */
enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    static final String SIMPLE_LOGGER_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    /**
     * Must run before the first logger is created.
     */
    void apply() {
        System.setProperty(SIMPLE_LOGGER_PROPERTY, name().toLowerCase(Locale.ROOT));
    }
}
