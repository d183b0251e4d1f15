package ai.paper.translator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonLogLayoutTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void formatsEventAsSingleJsonLine() throws Exception {
        LoggerContext context = new LoggerContext();
        JsonLogLayout layout = newLayout(context);
        LoggingEvent event = newEvent(context, "Chunk 3 translated \"quickly\"\nnext", Map.of("chunk", "3"));

        String json = layout.doLayout(event);

        assertThat(json).endsWith(System.lineSeparator());
        assertThat(json.strip()).doesNotContain("\n");
        JsonNode node = mapper.readTree(json);
        assertThat(node.get("timestamp").asText()).isEqualTo("1970-01-01T00:00:00Z");
        assertThat(node.get("level").asText()).isEqualTo("INFO");
        assertThat(node.get("logger").asText()).isEqualTo("test.logger");
        assertThat(node.get("thread").asText()).isEqualTo("translation-worker-1");
        assertThat(node.get("message").asText()).isEqualTo("Chunk 3 translated \"quickly\"\nnext");
        assertThat(node.get("mdc").get("chunk").asText()).isEqualTo("3");
        assertThat(node.has("exception")).isFalse();
    }

    @Test
    void includesExceptionClassAndMessage() throws Exception {
        LoggerContext context = new LoggerContext();
        JsonLogLayout layout = newLayout(context);
        LoggingEvent event = newEvent(context, "Translation run aborted", Map.of());
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("pool closed")));

        JsonNode node = mapper.readTree(layout.doLayout(event));

        assertThat(node.get("exception").get("class").asText()).isEqualTo("java.lang.IllegalStateException");
        assertThat(node.get("exception").get("message").asText()).isEqualTo("pool closed");
    }

    private static JsonLogLayout newLayout(LoggerContext context) {
        context.start();
        JsonLogLayout layout = new JsonLogLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private static LoggingEvent newEvent(LoggerContext context, String message, Map<String, String> mdc) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("translation-worker-1");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        event.setMDCPropertyMap(mdc);
        return event;
    }
}
