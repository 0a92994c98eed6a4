package ai.docsite.markdown.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class JsonLogLayoutTest {

    @Test
    void formatsEventAsJson() throws Exception {
        LoggingEvent event = event("parsed \"doc\"");

        String json = layout().doLayout(event);

        JsonNode parsed = new ObjectMapper().readTree(json);
        assertThat(parsed.get("timestamp").asText()).isEqualTo("1970-01-01T00:00:00Z");
        assertThat(parsed.get("level").asText()).isEqualTo("INFO");
        assertThat(parsed.get("logger").asText()).isEqualTo("test.logger");
        assertThat(parsed.get("thread").asText()).isEqualTo("main");
        assertThat(parsed.get("message").asText()).isEqualTo("parsed \"doc\"");
        assertThat(parsed.has("exception")).isFalse();
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void includesStackTraceOfAttachedThrowable() throws Exception {
        LoggingEvent event = event("failed");
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("boom")));

        JsonNode parsed = new ObjectMapper().readTree(layout().doLayout(event));

        assertThat(parsed.get("exception").asText()).contains("java.lang.IllegalStateException: boom");
    }

    private static JsonLogLayout layout() {
        LoggerContext context = new LoggerContext();
        context.start();
        JsonLogLayout layout = new JsonLogLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private static LoggingEvent event(String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        return event;
    }
}
