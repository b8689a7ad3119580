package nl.nfi.cnfparse.common.logger;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.Configurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.tyler.TylerConfiguratorBase;
import ch.qos.logback.core.FileAppender;

import java.nio.file.Path;

// a batch run writes one log file into LOG_DIRECTORY_PATH; without that property nothing is logged
public final class LoggerConfigurator extends TylerConfiguratorBase implements Configurator {

    static final String LOG_DIRECTORY_PROPERTY = "LOG_DIRECTORY_PATH";
    static final String LOG_FILE_NAME = "cnf-parse.log";

    private static final String LOG_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{0} - %msg%n";

    @Override
    public ExecutionStatus configure(final LoggerContext loggerContext) {
        final String logDirectoryPath = System.getProperty(LOG_DIRECTORY_PROPERTY);
        if (logDirectoryPath == null) {
            return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
        }

        setContext(loggerContext);
        final Logger root = setupLogger("ROOT", "DEBUG", null);
        root.addAppender(createFileAppender(Path.of(logDirectoryPath).resolve(LOG_FILE_NAME)));

        return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
    }

    private FileAppender<ILoggingEvent> createFileAppender(final Path logFile) {
        final FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName("FILE");
        appender.setFile(logFile.toString());

        final PatternLayoutEncoder layoutEncoder = new PatternLayoutEncoder();
        layoutEncoder.setContext(context);
        layoutEncoder.setPattern(LOG_PATTERN);
        layoutEncoder.setParent(appender);
        layoutEncoder.start();

        appender.setEncoder(layoutEncoder);
        appender.start();
        return appender;
    }
}
