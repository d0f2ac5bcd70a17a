package com.tracelake.normalization.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.tracelake.domain.ConnectionEvent;
import com.tracelake.domain.EventKind;
import com.tracelake.domain.NormalizedEvent;
import com.tracelake.normalization.RecordKeyGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Parser for "Connection accepted" / "Connection ended" entries
 */
@Component
public class ConnectionParser extends StructuredLogParser {

    private static final Logger log = LoggerFactory.getLogger(ConnectionParser.class);

    private final RecordKeyGenerator keyGenerator;

    public ConnectionParser(RecordKeyGenerator keyGenerator) {
        this.keyGenerator = keyGenerator;
    }

    @Override
    public NormalizedEvent parse(JsonNode entry, ParseContext context) throws ParseException {
        String lowered = message(entry).toLowerCase(Locale.ROOT);
        String event;
        if (lowered.contains("connection accepted")) {
            event = ConnectionEvent.EVENT_ACCEPTED;
        } else if (lowered.contains("connection ended")) {
            event = ConnectionEvent.EVENT_ENDED;
        } else {
            return null;
        }
        JsonNode attr = attributes(entry);
        EventTime time = parseTime(entry);

        String remote = remoteAddress(attr);
        String appName = text(attr, "appName");

        return ConnectionEvent.builder()
            .recordKey(keyGenerator.connectionKey(event, remote, appName))
            .timestamp(time.getIso(), time.getEpochSeconds())
            .span(context.getSpan(), context.getLineNumber())
            .sample(context.getSample())
            .event(event)
            .connectionId(connectionId(attr, entry))
            .remoteAddress(remote)
            .connectionCount(connectionCount(attr, context))
            .appName(appName)
            .driver(text(attr, "driver"))
            .build();
    }

    @Override
    public EventKind getKind() {
        return EventKind.CONNECTION;
    }

    /**
     * {@code attr.connectionCount}; a value that is not an integer is dropped, not fatal
     */
    private Integer connectionCount(JsonNode attr, ParseContext context) {
        JsonNode count = attr.path("connectionCount");
        if (count.isMissingNode() || count.isNull()) {
            return null;
        }
        if (count.canConvertToInt()) {
            return count.intValue();
        }
        try {
            return Integer.valueOf(count.asText().trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-integer connectionCount on line {}", context.getLineNumber());
            return null;
        }
    }
}
