package ai.paper.translator.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders each logging event as one JSON object per line, including MDC entries such as the chunk number.
 */
public class JsonLogLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String doLayout(ILoggingEvent event) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        fields.put("level", event.getLevel().toString());
        fields.put("logger", event.getLoggerName());
        fields.put("thread", event.getThreadName());
        fields.put("message", event.getFormattedMessage());

        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null && !mdc.isEmpty()) {
            fields.put("mdc", new TreeMap<>(mdc));
        }
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            Map<String, String> exception = new LinkedHashMap<>();
            exception.put("class", throwable.getClassName());
            exception.put("message", throwable.getMessage());
            fields.put("exception", exception);
        }

        try {
            return MAPPER.writeValueAsString(fields) + System.lineSeparator();
        } catch (JsonProcessingException ex) {
            addError("Failed to render log event as JSON", ex);
            return "{\"level\":\"" + event.getLevel() + "\",\"message\":\"<unrenderable>\"}" + System.lineSeparator();
        }
    }
}
