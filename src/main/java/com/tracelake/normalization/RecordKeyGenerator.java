package com.tracelake.normalization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives deterministic record keys from the identifying fields of an event.
 *
 * Keys never depend on the position of a line in its file, so the same logical
 * event keeps its key across re-ingests. For slow queries the key is the
 * server-provided {@code queryHash}; when that is absent a synthetic hash of
 * the query shape is used (namespace, operation, filter field names, pipeline
 * stages and sort spec) so that queries differing only in literal values share
 * a key.
 */
@Component
public class RecordKeyGenerator {

    private static final List<String> OPERATION_KEYS =
        List.of("find", "aggregate", "update", "delete", "insert", "command");
    private static final Pattern TEXT_COMMAND = Pattern.compile("command\\s+(\\w+)", Pattern.CASE_INSENSITIVE);
    private static final int MAX_STRUCTURE_DEPTH = 2;

    private final ObjectMapper canonicalMapper;

    public RecordKeyGenerator() {
        this.canonicalMapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    /**
     * Key of a slow query: the given query hash, or a synthetic shape hash
     */
    public String slowQueryKey(String queryHash, String database, String collection, JsonNode command) {
        if (queryHash != null && !queryHash.isEmpty()) {
            return queryHash;
        }
        return md5(String.join("|", shapeParts(database, collection, command)));
    }

    public String authKey(String user, String database, String mechanism, String result) {
        return md5(String.join("|", "auth", nz(user), nz(database), nz(mechanism), nz(result)));
    }

    /**
     * Key of a connection event. The port is dropped from the remote address
     * so ephemeral client ports do not split otherwise identical events.
     */
    public String connectionKey(String event, String remoteAddress, String appName) {
        return md5(String.join("|", "connection", nz(event), remoteHost(remoteAddress), nz(appName)));
    }

    List<String> shapeParts(String database, String collection, JsonNode command) {
        List<String> parts = new ArrayList<>();
        parts.add((database == null || database.isEmpty() ? "unknown" : database)
            + "." + (collection == null || collection.isEmpty() ? "unknown" : collection));

        if (command == null || command.isMissingNode() || command.isNull()
            || (command.isObject() && command.isEmpty())) {
            parts.add("query:unknown");
            return parts;
        }
        if (!command.isObject()) {
            String text = command.asText().trim();
            parts.add(text.isEmpty() ? "query:unknown" : normalizeText(text));
            return parts;
        }

        String operation = null;
        for (String key : OPERATION_KEYS) {
            if (command.has(key)) {
                operation = key;
                break;
            }
        }
        if (operation != null) {
            parts.add("op:" + operation);
        } else {
            parts.add("op:filter");
            addSorted(parts, "filter:", structure(command, 0));
        }
        if (command.has("filter")) {
            addSorted(parts, "filter:", structure(command.get("filter"), 0));
        }
        JsonNode pipeline = command.path("pipeline");
        if (pipeline.isArray()) {
            addPipeline(parts, pipeline);
        }
        addStatementFilters(parts, command.path("updates"), "updates_filter:");
        addStatementFilters(parts, command.path("deletes"), "deletes_filter:");
        JsonNode sort = command.path("sort");
        if (sort.isObject() && !sort.isEmpty()) {
            parts.add("sort:" + sortSpec(sort));
        }
        return parts;
    }

    private void addPipeline(List<String> parts, JsonNode pipeline) {
        List<String> stages = new ArrayList<>();
        List<String> sorts = new ArrayList<>();
        Set<String> matchFields = new TreeSet<>();
        for (JsonNode stage : pipeline) {
            if (!stage.isObject()) {
                continue;
            }
            Iterator<String> names = stage.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                if (name.startsWith("$")) {
                    stages.add(name);
                }
            }
            JsonNode sort = stage.path("$sort");
            if (sort.isObject() && !sort.isEmpty()) {
                sorts.add(sortSpec(sort));
            }
            JsonNode match = stage.path("$match");
            if (match.isObject()) {
                matchFields.addAll(structure(match, 0));
                matchFields.add("match_values_" + md5(canonical(match)).substring(0, 8));
            }
        }
        if (!stages.isEmpty()) {
            parts.add("pipeline:" + String.join(",", stages));
        }
        if (!sorts.isEmpty()) {
            parts.add("pipeline_sort:" + String.join(",", sorts));
        }
        if (!matchFields.isEmpty()) {
            parts.add("pipeline_match:" + String.join(",", matchFields));
        }
    }

    private void addStatementFilters(List<String> parts, JsonNode statements, String prefix) {
        if (!statements.isArray()) {
            return;
        }
        Set<String> fields = new TreeSet<>();
        for (JsonNode statement : statements) {
            if (statement.isObject() && statement.has("q")) {
                fields.addAll(structure(statement.get("q"), 0));
            }
        }
        addSorted(parts, prefix, fields);
    }

    /**
     * Non-operator field names of a filter document, two levels deep.
     * Regex predicates contribute a hash of their pattern.
     */
    private Set<String> structure(JsonNode filter, int depth) {
        Set<String> fields = new TreeSet<>();
        if (depth >= MAX_STRUCTURE_DEPTH || filter == null || !filter.isObject()) {
            return fields;
        }
        Iterator<Map.Entry<String, JsonNode>> it = filter.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            if (!key.startsWith("$")) {
                fields.add(key);
                if (value.isObject() && value.has("$regex")) {
                    JsonNode pattern = value.get("$regex");
                    if (pattern.isObject() && pattern.has("$regularExpression")) {
                        pattern = pattern.get("$regularExpression").path("pattern");
                    }
                    String patternText = pattern.isValueNode() ? pattern.asText() : pattern.toString();
                    fields.add(key + "_regex_" + md5(patternText).substring(0, 8));
                }
            }
            if (value.isObject()) {
                fields.addAll(structure(value, depth + 1));
            } else if (value.isArray()) {
                for (JsonNode item : value) {
                    if (item.isObject()) {
                        fields.addAll(structure(item, depth + 1));
                    }
                }
            }
        }
        return fields;
    }

    private static String sortSpec(JsonNode sort) {
        List<String> spec = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = sort.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            JsonNode direction = field.getValue();
            int value = direction.isNumber() ? direction.intValue() : parseDirection(direction.asText());
            spec.add(field.getKey() + ":" + value);
        }
        return String.join(",", spec);
    }

    private static int parseDirection(String direction) {
        try {
            return Integer.parseInt(direction.trim());
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private static void addSorted(List<String> parts, String prefix, Set<String> fields) {
        if (!fields.isEmpty()) {
            parts.add(prefix + String.join(",", fields));
        }
    }

    private static String normalizeText(String text) {
        String lowered = text.toLowerCase();
        if (lowered.contains("command")) {
            Matcher matcher = TEXT_COMMAND.matcher(text);
            if (matcher.find()) {
                return "command:" + matcher.group(1);
            }
        }
        if (lowered.contains("slow query")) {
            return "slow_query";
        }
        String head = text.length() > 50 ? text.substring(0, 50) : text;
        return head.replaceAll("\\s+", " ").trim();
    }

    private String canonical(JsonNode node) {
        try {
            Object value = canonicalMapper.treeToValue(node, Object.class);
            return canonicalMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return node.toString();
        }
    }

    static String remoteHost(String remoteAddress) {
        if (remoteAddress == null) {
            return "";
        }
        if (remoteAddress.startsWith("[")) {
            int close = remoteAddress.indexOf(']');
            return close > 0 ? remoteAddress.substring(1, close) : remoteAddress;
        }
        int colon = remoteAddress.lastIndexOf(':');
        if (colon > 0 && remoteAddress.indexOf(':') == colon) {
            return remoteAddress.substring(0, colon);
        }
        return remoteAddress;
    }

    private static String nz(String value) {
        return value == null ? "" : value;
    }

    private static String md5(String value) {
        return DigestUtils.md5DigestAsHex(value.getBytes(StandardCharsets.UTF_8));
    }
}
