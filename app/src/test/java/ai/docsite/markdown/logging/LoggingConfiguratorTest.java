package ai.docsite.markdown.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.markdown.config.LogFormat;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void restoreTextFormat() {
        LoggingConfigurator.configure(LogFormat.TEXT, false);
    }

    @Test
    void verboseRaisesLibraryLoggerToDebug() {
        LoggingConfigurator.configure(LogFormat.TEXT, true);
        assertThat(context.getLogger(LoggingConfigurator.LIBRARY_LOGGER).getLevel()).isEqualTo(Level.DEBUG);

        LoggingConfigurator.configure(LogFormat.TEXT, false);
        assertThat(context.getLogger(LoggingConfigurator.LIBRARY_LOGGER).getLevel()).isNull();
    }

    @Test
    @SuppressWarnings("unchecked")
    void jsonFormatSwapsConsoleEncoder() {
        LoggingConfigurator.configure(LogFormat.JSON, false);

        OutputStreamAppender<ILoggingEvent> console =
                (OutputStreamAppender<ILoggingEvent>) context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("CONSOLE");
        assertThat(console.getEncoder()).isInstanceOfSatisfying(LayoutWrappingEncoder.class,
                encoder -> assertThat(encoder.getLayout()).isInstanceOf(JsonLogLayout.class));
        assertThat(console.isStarted()).isTrue();
    }
}
