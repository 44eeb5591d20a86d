package io.supervisedproxy.server.proxy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Reconfigures Logback once the proxy configuration is known.
 *
 * <p>
 * {@code logging.format: json} switches the console to Logback's built-in
 * {@link JsonEncoder}; anything else uses {@link #TEXT_PATTERN}. The echoed
 * backend output ({@code io.supervisedproxy.backend}) goes through the same
 * appender, so it lands in the same stream and format as the proxy's own
 * lines.
 */
public final class LogbackConfigurator {

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    /** Third-party loggers kept quiet regardless of the root level. */
    private static final Map<String, Level> FIXED_LEVELS = Map.of(
            "org.eclipse.jetty", Level.WARN,
            "io.javalin", Level.INFO,
            "jdk.internal.httpclient", Level.WARN);

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Replaces the root appender and level.
     *
     * @param format "json" or "text"
     * @param level  TRACE, DEBUG, INFO, WARN or ERROR; unknown values mean INFO
     */
    public static void configure(String format, String level) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(level, Level.INFO));
        root.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setContext(context);
        console.setName("CONSOLE");
        console.setEncoder(encoderFor(format, context));
        console.start();
        root.addAppender(console);

        FIXED_LEVELS.forEach((name, fixed) -> context.getLogger(name).setLevel(fixed));
    }

    private static Encoder<ILoggingEvent> encoderFor(String format, LoggerContext context) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}
