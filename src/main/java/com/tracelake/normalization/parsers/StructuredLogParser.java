package com.tracelake.normalization.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Shared field access for parsers of JSON-per-line server logs
 * ({@code t.$date}, {@code c}, {@code ctx}, {@code msg}, {@code attr}).
 */
public abstract class StructuredLogParser implements EventParser {

    private static final DateTimeFormatter COMPACT_OFFSET = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
        .appendOffset("+HHMM", "Z")
        .toFormatter();

    private static final List<DateTimeFormatter> OFFSET_FORMATS = List.of(
        DateTimeFormatter.ISO_OFFSET_DATE_TIME,
        COMPACT_OFFSET
    );

    /**
     * Parsed event time: ISO-8601 text with offset plus epoch seconds
     */
    public static final class EventTime {
        private final String iso;
        private final long epochSeconds;

        EventTime(OffsetDateTime time) {
            this.iso = DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(time);
            this.epochSeconds = time.toEpochSecond();
        }

        public String getIso() {
            return iso;
        }

        public long getEpochSeconds() {
            return epochSeconds;
        }
    }

    /**
     * Reads {@code t.$date}. Accepts ISO-8601 with {@code +00:00}, {@code +0000} or {@code Z}
     * offsets (fractional seconds optional), and epoch millis in {@code $numberLong} form.
     */
    public static EventTime parseTime(JsonNode entry) {
        JsonNode date = entry.path("t").path("$date");
        if (date.isMissingNode() || date.isNull()) {
            throw new TimestampException("Missing timestamp", null);
        }
        if (date.isNumber()) {
            return new EventTime(Instant.ofEpochMilli(date.asLong()).atOffset(ZoneOffset.UTC));
        }
        if (date.isObject() && date.has("$numberLong")) {
            String millis = date.get("$numberLong").asText();
            try {
                return new EventTime(Instant.ofEpochMilli(Long.parseLong(millis)).atOffset(ZoneOffset.UTC));
            } catch (NumberFormatException e) {
                throw new TimestampException("Unparsable timestamp", millis);
            }
        }
        return parseTime(date.asText());
    }

    public static EventTime parseTime(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new TimestampException("Missing timestamp", raw);
        }
        String text = raw.trim();
        for (DateTimeFormatter format : OFFSET_FORMATS) {
            try {
                return new EventTime(OffsetDateTime.parse(text, format));
            } catch (DateTimeParseException e) {
                // next format
            }
        }
        try {
            return new EventTime(LocalDateTime.parse(text).atOffset(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            throw new TimestampException("Unparsable timestamp: " + text, text);
        }
    }

    /**
     * The {@code attr} object of the entry, or a missing node when absent.
     * A present but non-object {@code attr} is malformed.
     */
    protected JsonNode attributes(JsonNode entry) {
        JsonNode attr = entry.path("attr");
        if (attr.isMissingNode() || attr.isNull()) {
            return MissingNode.getInstance();
        }
        if (!attr.isObject()) {
            throw new ParseException("attr is not an object");
        }
        return attr;
    }

    protected static String message(JsonNode entry) {
        JsonNode msg = entry.path("msg");
        return msg.isTextual() ? msg.asText() : "";
    }

    /**
     * First non-empty value among the given fields, as text
     */
    protected static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.path(field);
            if (value.isMissingNode() || value.isNull()) {
                continue;
            }
            String text = value.isValueNode() ? value.asText() : value.toString();
            if (!text.isEmpty()) {
                return text;
            }
        }
        return null;
    }

    /**
     * Numeric field as long; absent or null counts as 0. Accepts numbers, numeric
     * strings and extended-JSON wrappers such as {@code {"$numberLong": "12"}}.
     */
    protected static long longValue(JsonNode node, String field) {
        return coerceLong(node.path(field), field);
    }

    protected static long firstNonZero(JsonNode node, String... fields) {
        for (String field : fields) {
            long value = longValue(node, field);
            if (value != 0) {
                return value;
            }
        }
        return 0;
    }

    private static long coerceLong(JsonNode value, String field) {
        if (value.isMissingNode() || value.isNull()) {
            return 0;
        }
        if (value.isNumber()) {
            return value.longValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue() ? 1 : 0;
        }
        if (value.isObject()) {
            for (String wrapper : List.of("$numberLong", "$numberInt", "$numberDouble")) {
                if (value.has(wrapper)) {
                    return coerceLong(value.get(wrapper), field);
                }
            }
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (text.isEmpty()) {
                return 0;
            }
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                try {
                    return (long) Double.parseDouble(text);
                } catch (NumberFormatException nested) {
                    throw new ParseException("Field " + field + " is not numeric: " + text, nested);
                }
            }
        }
        throw new ParseException("Field " + field + " is not numeric: " + value);
    }

    protected static String remoteAddress(JsonNode attr) {
        return text(attr, "remote", "client", "remoteAddr", "remote_address");
    }

    protected static String connectionId(JsonNode attr, JsonNode entry) {
        String id = text(attr, "connectionId", "connId");
        return id != null ? id : text(entry, "ctx");
    }
}
