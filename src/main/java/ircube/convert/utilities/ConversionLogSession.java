package ircube.convert.utilities;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Copies converter log output into a file inside the directory being converted.
 *
 * <p>While a session is open, every {@code ircube.convert} log event is also written to
 * {@code <directory>/conversion.log} (appending), so that a batch leaves a record of which
 * files failed and why next to its outputs.</p>
 *
 * <pre>{@code
 * try (ConversionLogSession session = ConversionLogSession.start(directory)) {
 *     logger.info("Starting batch...");
 *     // ... conversion ...
 * } // file appender detached
 * }</pre>
 *
 * <p>If the directory does not exist, or the logging backend is not Logback, the session is
 * inactive and closing it does nothing.</p>
 */
public final class ConversionLogSession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConversionLogSession.class);

    public static final String LOG_FILE_NAME = "conversion.log";
    static final String LOGGER_NAME = "ircube.convert";

    private final FileAppender<ILoggingEvent> appender;
    private final Path logFile;

    private ConversionLogSession(FileAppender<ILoggingEvent> appender, Path logFile) {
        this.appender = appender;
        this.logFile = logFile;
    }

    /**
     * Starts logging to {@code <directory>/conversion.log}.
     *
     * @param directory the directory to write the log file into
     * @return a session, inactive if logging could not be enabled
     */
    public static ConversionLogSession start(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            logger.warn("Cannot enable directory logging: invalid directory: {}", directory);
            return new ConversionLogSession(null, null);
        }

        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            logger.warn("Directory logging needs Logback, found {}", factory.getClass().getName());
            return new ConversionLogSession(null, null);
        }
        LoggerContext context = (LoggerContext) factory;
        Path logFile = directory.resolve(LOG_FILE_NAME);

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level %logger{36} - %msg%n");
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName("CONVERSION_LOG_" + directory.toAbsolutePath());
        appender.setFile(logFile.toAbsolutePath().toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        if (!appender.isStarted()) {
            logger.warn("Could not open log file {}", logFile);
            return new ConversionLogSession(null, null);
        }

        context.getLogger(LOGGER_NAME).addAppender(appender);
        logger.info("Directory logging enabled: {}", logFile);
        return new ConversionLogSession(appender, logFile);
    }

    public boolean isActive() {
        return appender != null;
    }

    /** The log file being written, or null for an inactive session. */
    public Path getLogFile() {
        return logFile;
    }

    @Override
    public void close() {
        if (appender == null) {
            return;
        }
        logger.info("Directory logging disabled: {}", logFile);
        LoggerContext context = (LoggerContext) appender.getContext();
        context.getLogger(LOGGER_NAME).detachAppender(appender);
        appender.stop();
    }
}
