package ai.subtitle.translator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.subtitle.translator.config.LogFormat;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

    @AfterEach
    void restoreTextFormat() {
        LoggingConfigurator.configure(LogFormat.TEXT);
    }

    @Test
    void switchesConsoleEncoderBetweenFormats() {
        LoggingConfigurator.configure(LogFormat.JSON);
        assertThat(consoleAppender().getEncoder()).isInstanceOfSatisfying(LayoutWrappingEncoder.class,
                encoder -> assertThat(encoder.getLayout()).isInstanceOf(SimpleJsonLayout.class));

        LoggingConfigurator.configure(LogFormat.TEXT);
        assertThat(consoleAppender().getEncoder()).isInstanceOfSatisfying(PatternLayoutEncoder.class,
                encoder -> assertThat(encoder.getPattern()).isEqualTo(LoggingConfigurator.TEXT_PATTERN));
        assertThat(consoleAppender().isStarted()).isTrue();
    }

    private static OutputStreamAppender<ILoggingEvent> consoleAppender() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        return (OutputStreamAppender<ILoggingEvent>) root.getAppender("CONSOLE");
    }
}
