package com.tracelake.normalization.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.tracelake.domain.EventKind;
import com.tracelake.domain.NormalizedEvent;

/**
 * Interface for turning one decoded log entry into a typed event.
 * Implementations handle exactly one {@link EventKind}.
 */
public interface EventParser {

    /**
     * Parses a decoded log entry already classified as this parser's kind
     *
     * @param entry the JSON document of the line
     * @param context span, line number and sample of the line
     * @return the typed event, or null when the entry turns out not to be an event of this kind
     * @throws ParseException if the entry matches the kind but its fields are malformed
     */
    NormalizedEvent parse(JsonNode entry, ParseContext context) throws ParseException;

    /**
     * Returns the event kind this parser handles
     */
    EventKind getKind();
}
