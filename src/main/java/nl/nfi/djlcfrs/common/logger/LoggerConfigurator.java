package nl.nfi.djlcfrs.common.logger;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.Configurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.tyler.TylerConfiguratorBase;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeAndTimeBasedRollingPolicy;
import ch.qos.logback.core.util.FileSize;

import java.net.InetAddress;
import java.net.UnknownHostException;

// without LOG_DIRECTORY_PATH, INFO and up go to standard error (standard output carries the rules),
// with it, everything goes to a rolling file per host
public final class LoggerConfigurator extends TylerConfiguratorBase implements Configurator {

    static {
        System.setProperty("slf4j.internal.verbosity", "ERROR");
    }

    private static final String FILE_LOG_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{2000} -%kvp- %msg%n";
    private static final String CONSOLE_LOG_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{0} - %msg%n";

    @Override
    public ExecutionStatus configure(final LoggerContext loggerContext) {
        setContext(loggerContext);

        final String logDirectoryPath = System.getProperty("LOG_DIRECTORY_PATH");
        final Logger root;
        if (logDirectoryPath == null) {
            root = setupLogger("ROOT", "INFO", null);
            root.addAppender(createConsoleAppender());
        } else {
            root = setupLogger("ROOT", "DEBUG", null);
            root.addAppender(createFileAppender(logDirectoryPath));
        }

        return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
    }

    private Appender<ILoggingEvent> createConsoleAppender() {
        final ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName("CONSOLE");
        appender.setTarget("System.err");
        return start(appender, CONSOLE_LOG_PATTERN);
    }

    private Appender<ILoggingEvent> createFileAppender(final String logDirectoryPath) {
        final String fileName = "lcfrs_inducer-" + hostname();

        final RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setContext(context);
        appender.setName("FILE");
        appender.setFile(logDirectoryPath + "/" + fileName + ".log");

        final SizeAndTimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new SizeAndTimeBasedRollingPolicy<>();
        rollingPolicy.setContext(context);
        rollingPolicy.setFileNamePattern(logDirectoryPath + "/" + fileName + ".%d{yyyy-MM-dd}.%i.gz");
        rollingPolicy.setMaxFileSize(FileSize.valueOf("100MB"));
        rollingPolicy.setMaxHistory(30);
        rollingPolicy.setTotalSizeCap(FileSize.valueOf("1GB"));
        rollingPolicy.setParent(appender);
        rollingPolicy.start();

        appender.setRollingPolicy(rollingPolicy);
        return start(appender, FILE_LOG_PATTERN);
    }

    private Appender<ILoggingEvent> start(final OutputStreamAppender<ILoggingEvent> appender, final String pattern) {
        final PatternLayoutEncoder layoutEncoder = new PatternLayoutEncoder();
        layoutEncoder.setContext(context);
        layoutEncoder.setPattern(pattern);
        layoutEncoder.setParent(appender);
        layoutEncoder.start();

        appender.setEncoder(layoutEncoder);
        appender.start();
        return appender;
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (final UnknownHostException e) {
            return "localhost";
        }
    }
}
