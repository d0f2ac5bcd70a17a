package com.tracelake.normalization.parsers;

import com.tracelake.domain.EventKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registry for managing event parsers by event kind.
 * Every kind must have exactly one parser.
 */
@Component
public class ParserRegistry {

    private final Map<EventKind, EventParser> parsers = new EnumMap<>(EventKind.class);

    public ParserRegistry(List<EventParser> available) {
        for (EventParser parser : available) {
            registerParser(parser);
        }
        for (EventKind kind : EventKind.values()) {
            if (!parsers.containsKey(kind)) {
                throw new IllegalStateException("No parser registered for " + kind);
            }
        }
    }

    /**
     * Gets the parser for the specified event kind
     *
     * @param kind the event kind
     * @return the parser for that kind
     */
    public EventParser getParser(EventKind kind) {
        return parsers.get(kind);
    }

    /**
     * Registers a parser for the kind it declares, replacing any earlier one
     *
     * @param parser the parser implementation
     */
    public void registerParser(EventParser parser) {
        parsers.put(parser.getKind(), parser);
    }
}
