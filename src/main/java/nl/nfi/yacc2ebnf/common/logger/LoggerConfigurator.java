package nl.nfi.yacc2ebnf.common.logger;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.Configurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.tyler.TylerConfiguratorBase;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeAndTimeBasedRollingPolicy;
import ch.qos.logback.core.util.FileSize;

// diagnostics go to standard error, standard output is reserved for the converted grammar
public final class LoggerConfigurator extends TylerConfiguratorBase implements Configurator {

    static {
        System.setProperty("slf4j.internal.verbosity", "ERROR");
    }

    private static final String CONSOLE_PATTERN = "%-5level %msg%n";
    private static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{2000} -%kvp- %msg%n";

    @Override
    public ExecutionStatus configure(final LoggerContext loggerContext) {
        setContext(loggerContext);

        final Logger root = setupLogger("ROOT", "DEBUG", null);
        root.addAppender(createConsoleAppender(System.getProperty("LOG_LEVEL", "INFO")));

        final String logDirectoryPath = System.getProperty("LOG_DIRECTORY_PATH");
        if (logDirectoryPath != null) {
            root.addAppender(createFileAppender(logDirectoryPath));
        }

        return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
    }

    private Appender<ILoggingEvent> createConsoleAppender(final String level) {
        final ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName("CONSOLE");
        appender.setTarget("System.err");

        final ThresholdFilter filter = new ThresholdFilter();
        filter.setContext(context);
        filter.setLevel(Level.toLevel(level, Level.INFO).toString());
        filter.start();
        appender.addFilter(filter);

        appender.setEncoder(createEncoder(CONSOLE_PATTERN, appender));
        appender.start();
        return appender;
    }

    private Appender<ILoggingEvent> createFileAppender(final String logDirectoryPath) {
        final RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setContext(context);
        appender.setName("FILE");
        appender.setFile(logDirectoryPath + "/yacc2ebnf.log");

        final SizeAndTimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new SizeAndTimeBasedRollingPolicy<>();
        rollingPolicy.setContext(context);
        rollingPolicy.setFileNamePattern(logDirectoryPath + "/yacc2ebnf.%d{yyyy-MM-dd}.%i.gz");
        rollingPolicy.setMaxFileSize(FileSize.valueOf("100MB"));
        rollingPolicy.setMaxHistory(30);
        rollingPolicy.setTotalSizeCap(FileSize.valueOf("1GB"));
        rollingPolicy.setParent(appender);
        rollingPolicy.start();

        appender.setRollingPolicy(rollingPolicy);
        appender.setEncoder(createEncoder(FILE_PATTERN, appender));
        appender.start();
        return appender;
    }

    private PatternLayoutEncoder createEncoder(final String pattern, final Appender<ILoggingEvent> appender) {
        final PatternLayoutEncoder layoutEncoder = new PatternLayoutEncoder();
        layoutEncoder.setContext(context);
        layoutEncoder.setPattern(pattern);
        layoutEncoder.setParent(appender);
        layoutEncoder.start();
        return layoutEncoder;
    }
}
