package com.tracelake.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.tracelake.domain.EventKind;
import com.tracelake.normalization.parsers.AuthParser;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Detects the event kind of a log line using heuristics.
 *
 * {@link #sniff(String)} works on raw text so that a line which fails to
 * decode can still be attributed to the kind it resembles.
 * {@link #classify(JsonNode)} is the authoritative check on a decoded entry.
 * Both apply the same precedence: slow query, then connection, then auth.
 */
@Component
public class EventKindDetector {

    private static final Pattern ACCESS_COMPONENT = Pattern.compile("\"c\"\\s*:\\s*\"ACCESS\"");

    /**
     * Kind the raw line resembles, or null
     */
    public EventKind sniff(String line) {
        if (line == null || line.isEmpty()) {
            return null;
        }
        String lowered = line.toLowerCase(Locale.ROOT);
        if (lowered.contains("slow query")) {
            return EventKind.SLOW_QUERY;
        }
        if (lowered.contains("connection accepted") || lowered.contains("connection ended")) {
            return EventKind.CONNECTION;
        }
        if (ACCESS_COMPONENT.matcher(line).find() && AuthParser.matchResult(lowered) != null) {
            return EventKind.AUTH;
        }
        return null;
    }

    /**
     * Kind of a decoded entry based on its {@code msg} and {@code c} fields, or null
     */
    public EventKind classify(JsonNode entry) {
        JsonNode msg = entry.path("msg");
        String message = msg.isTextual() ? msg.asText().toLowerCase(Locale.ROOT) : "";
        if (message.contains("slow query")) {
            return EventKind.SLOW_QUERY;
        }
        if (message.contains("connection accepted") || message.contains("connection ended")) {
            return EventKind.CONNECTION;
        }
        if ("ACCESS".equals(entry.path("c").asText(null)) && AuthParser.matchResult(message) != null) {
            return EventKind.AUTH;
        }
        return null;
    }
}
