package com.tracelake.analysis;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Index candidates read from the shape of a logged command document.
 *
 * Only top-level equality and range fields of a {@code find} filter or of an
 * aggregation {@code $match} count, together with {@code sort} and
 * {@code $sort} keys. Logical operators are left for manual review.
 */
final class QueryShapes {

    static final String PRIORITY_HIGH = "high";
    static final String PRIORITY_MEDIUM = "medium";

    private static final Set<String> LOGICAL_OPERATORS = Set.of("$and", "$or", "$nor", "$expr");
    private static final int MAX_COMPOUND_SORT_FIELDS = 3;

    private QueryShapes() {
    }

    static List<Candidate> candidates(JsonNode command) {
        if (command == null || !command.isObject()) {
            return List.of();
        }
        if (command.has("find")) {
            return findCandidates(command);
        }
        if (command.has("aggregate")) {
            return aggregateCandidates(command.path("pipeline"));
        }
        return List.of();
    }

    private static List<Candidate> findCandidates(JsonNode command) {
        List<Candidate> candidates = new ArrayList<>();
        JsonNode filter = command.path("filter");
        JsonNode sort = command.path("sort");

        List<String> filterFields = filterFields(filter);
        for (String field : filterFields) {
            candidates.add(new Candidate(IndexSpec.of(field, 1), "single_field", "Filter on " + field, PRIORITY_HIGH));
        }

        List<Map.Entry<String, JsonNode>> sortKeys = keys(sort);
        IndexSpec sortSpec = sortSpec(sortKeys);
        if (sortSpec != null && sortKeys.size() == 1) {
            candidates.add(new Candidate(sortSpec, "sort", "Sort by " + sortKeys.get(0).getKey(), PRIORITY_HIGH));
        } else if (sortSpec != null && sortKeys.size() <= MAX_COMPOUND_SORT_FIELDS) {
            candidates.add(new Candidate(sortSpec, "compound_sort",
                "Compound sort on " + String.join(", ", sortSpec.getFields()), PRIORITY_MEDIUM));
        }

        if (filterFields.size() == 1 && keys(filter).size() == 1 && sortSpec != null && sortKeys.size() == 1) {
            String filterField = filterFields.get(0);
            String sortField = sortSpec.getFields().get(0);
            if (!filterField.equals(sortField)) {
                IndexSpec compound = IndexSpec.builder()
                    .key(filterField, 1)
                    .key(sortField, sortSpec.getDirections().get(0))
                    .build();
                candidates.add(new Candidate(compound, "compound_filter_sort",
                    "Filter on " + filterField + " and sort by " + sortField, PRIORITY_HIGH));
            }
        }
        return candidates;
    }

    private static List<Candidate> aggregateCandidates(JsonNode pipeline) {
        List<Candidate> candidates = new ArrayList<>();
        if (!pipeline.isArray()) {
            return candidates;
        }
        for (JsonNode stage : pipeline) {
            if (stage.has("$match")) {
                for (String field : filterFields(stage.get("$match"))) {
                    candidates.add(new Candidate(IndexSpec.of(field, 1), "single_field",
                        "$match stage filter on " + field, PRIORITY_HIGH));
                }
            } else if (stage.has("$sort")) {
                List<Map.Entry<String, JsonNode>> sortKeys = keys(stage.get("$sort"));
                IndexSpec sortSpec = sortSpec(sortKeys);
                if (sortSpec != null && sortKeys.size() == 1) {
                    candidates.add(new Candidate(sortSpec, "aggregate_sort",
                        "$sort stage on " + sortKeys.get(0).getKey(), PRIORITY_HIGH));
                }
            }
        }
        return candidates;
    }

    private static List<String> filterFields(JsonNode filter) {
        List<String> fields = new ArrayList<>();
        for (Map.Entry<String, JsonNode> key : keys(filter)) {
            if (!LOGICAL_OPERATORS.contains(key.getKey())) {
                fields.add(key.getKey());
            }
        }
        return fields;
    }

    /**
     * Null when the sort is empty or a direction is not 1 or -1
     */
    private static IndexSpec sortSpec(List<Map.Entry<String, JsonNode>> sortKeys) {
        if (sortKeys.isEmpty()) {
            return null;
        }
        IndexSpec.Builder builder = IndexSpec.builder();
        for (Map.Entry<String, JsonNode> key : sortKeys) {
            JsonNode direction = key.getValue();
            if (!direction.isIntegralNumber() || Math.abs(direction.asInt()) != 1) {
                return null;
            }
            builder.key(key.getKey(), direction.asInt());
        }
        return builder.build();
    }

    private static List<Map.Entry<String, JsonNode>> keys(JsonNode node) {
        List<Map.Entry<String, JsonNode>> keys = new ArrayList<>();
        if (node != null && node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                keys.add(it.next());
            }
        }
        return keys;
    }

    static final class Candidate {
        private final IndexSpec spec;
        private final String type;
        private final String reason;
        private final String priority;

        Candidate(IndexSpec spec, String type, String reason, String priority) {
            this.spec = spec;
            this.type = type;
            this.reason = reason;
            this.priority = priority;
        }

        IndexSpec getSpec() {
            return spec;
        }

        String getType() {
            return type;
        }

        String getReason() {
            return reason;
        }

        String getPriority() {
            return priority;
        }
    }
}
