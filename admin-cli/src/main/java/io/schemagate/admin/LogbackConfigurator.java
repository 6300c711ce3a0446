package io.schemagate.admin;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback setup for structured JSON or text logging.
 *
 * <p>
 * Called once config is loaded. Replaces the root logger's appender and
 * level according to {@code logging.format} and {@code logging.level}.
 * Logs go to stderr so command output on stdout stays clean.
 */
public final class LogbackConfigurator {

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * @param format "json" for {@link JsonEncoder} output, anything else for text
     * @param level  root level name; unknown names fall back to INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);

        rootLogger.setLevel(Level.toLevel(level, Level.INFO));
        rootLogger.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName("STDERR");
        appender.setTarget("System.err");

        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            appender.setEncoder(encoder);
        } else {
            PatternLayoutEncoder encoder = new PatternLayoutEncoder();
            encoder.setContext(context);
            encoder.setPattern(TEXT_PATTERN);
            encoder.start();
            appender.setEncoder(encoder);
        }

        appender.start();
        rootLogger.addAppender(appender);

        // store-file validation is chatty at DEBUG
        context.getLogger("com.networknt").setLevel(Level.WARN);
    }
}
