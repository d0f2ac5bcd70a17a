package com.tracelake.normalization.parsers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.tracelake.domain.EventKind;
import com.tracelake.domain.NormalizedEvent;
import com.tracelake.domain.SlowQueryEvent;
import com.tracelake.normalization.RecordKeyGenerator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Parser for "Slow query" profiler entries.
 *
 * Namespace resolution: {@code attr.db} / {@code attr.collection} win over the
 * parts of {@code attr.ns}; missing parts become "unknown".
 */
@Component
public class SlowQueryParser extends StructuredLogParser {

    private static final List<String> COMMAND_NAMES =
        List.of("find", "aggregate", "update", "delete", "insert", "getMore");

    private final RecordKeyGenerator keyGenerator;
    private final ObjectMapper objectMapper;

    public SlowQueryParser(RecordKeyGenerator keyGenerator, ObjectMapper objectMapper) {
        this.keyGenerator = keyGenerator;
        this.objectMapper = objectMapper;
    }

    @Override
    public NormalizedEvent parse(JsonNode entry, ParseContext context) throws ParseException {
        JsonNode attr = attributes(entry);
        EventTime time = parseTime(entry);

        JsonNode command = attr.path("command");
        if (command.isMissingNode() || command.isNull() || (command.isObject() && command.isEmpty())) {
            command = attr.path("commandBody");
        }
        if (command.isNull()) {
            command = MissingNode.getInstance();
        }

        String ns = text(attr, "ns");
        String database = text(attr, "db");
        if (database == null) {
            database = ns != null ? ns.split("\\.", -1)[0] : null;
        }
        if (database == null || database.isEmpty()) {
            database = "unknown";
        }
        String collection = text(attr, "collection");
        if (collection == null) {
            String source = ns != null ? ns : "unknown.unknown";
            collection = source.substring(source.lastIndexOf('.') + 1);
        }
        if (collection.isEmpty()) {
            collection = "unknown";
        }
        String namespace = ns != null ? ns : database + "." + collection;

        String queryHash = keyGenerator.slowQueryKey(text(attr, "queryHash"), database, collection, command);
        String planSummary = text(attr, "planSummary");

        return SlowQueryEvent.builder()
            .recordKey(queryHash)
            .timestamp(time.getIso(), time.getEpochSeconds())
            .span(context.getSpan(), context.getLineNumber())
            .sample(context.getSample())
            .queryHash(queryHash)
            .namespace(database, collection, namespace)
            .planSummary(planSummary != null ? planSummary : "None")
            .queryText(stringify(command))
            .operation(inferOperation(attr, command))
            .connectionId(connectionId(attr, entry))
            .username(text(attr, "appName", "user"))
            .durationMs(longValue(attr, "durationMillis"))
            .docsExamined(longValue(attr, "docsExamined"))
            .docsReturned(firstNonZero(attr, "nReturned", "docsReturned"))
            .keysExamined(longValue(attr, "keysExamined"))
            .build();
    }

    @Override
    public EventKind getKind() {
        return EventKind.SLOW_QUERY;
    }

    String stringify(JsonNode command) {
        if (command.isMissingNode()) {
            return "{}";
        }
        if (command.isTextual()) {
            return command.asText();
        }
        try {
            return objectMapper.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            return command.toString();
        }
    }

    /**
     * Operation name from {@code commandName}, the command document's first
     * known verb, a single-key command, write statement arrays, or the plan summary.
     */
    String inferOperation(JsonNode attr, JsonNode command) {
        String commandName = text(attr, "commandName");
        if (commandName != null) {
            return commandName;
        }
        if (command.isObject()) {
            for (String key : COMMAND_NAMES) {
                if (command.has(key)) {
                    return key;
                }
            }
            String opName = text(command, "commandName", "operation");
            if (opName != null) {
                return opName;
            }
            if (command.size() == 1) {
                return command.fieldNames().next();
            }
            if (command.path("updates").isArray()) {
                return "update";
            }
            if (command.path("deletes").isArray()) {
                return "delete";
            }
            if (command.path("inserts").isArray()) {
                return "insert";
            }
            if (command.has("q") && command.has("u")) {
                return "update";
            }
            JsonNode nested = command.path("$query");
            if (nested.isObject()) {
                String nestedName = text(nested, "commandName");
                if (nestedName != null) {
                    return nestedName;
                }
            }
        }
        String planSummary = text(attr, "planSummary");
        return planSummary != null ? planSummary : "unknown";
    }
}
