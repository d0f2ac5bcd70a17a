package com.tracelake.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered list of index keys, each a field with direction 1 or -1
 */
public final class IndexSpec {

    private final List<String> fields;
    private final List<Integer> directions;

    private IndexSpec(List<String> fields, List<Integer> directions) {
        this.fields = Collections.unmodifiableList(fields);
        this.directions = Collections.unmodifiableList(directions);
    }

    public static IndexSpec of(String field, int direction) {
        return builder().key(field, direction).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getFields() {
        return fields;
    }

    public List<Integer> getDirections() {
        return directions;
    }

    public int size() {
        return fields.size();
    }

    /**
     * True when this spec's keys are the leading keys of the other spec
     */
    public boolean isPrefixOf(IndexSpec other) {
        if (size() > other.size()) {
            return false;
        }
        return other.fields.subList(0, size()).equals(fields)
            && other.directions.subList(0, size()).equals(directions);
    }

    /**
     * Shell form of the key document, e.g. {@code {status: 1, created: -1}}
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(fields.get(i)).append(": ").append(directions.get(i));
        }
        return sb.append('}').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndexSpec)) {
            return false;
        }
        IndexSpec that = (IndexSpec) o;
        return fields.equals(that.fields) && directions.equals(that.directions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields, directions);
    }

    public static class Builder {
        private final List<String> fields = new ArrayList<>();
        private final List<Integer> directions = new ArrayList<>();

        private Builder() {
        }

        public Builder key(String field, int direction) {
            if (direction != 1 && direction != -1) {
                throw new IllegalArgumentException("Index direction must be 1 or -1, got " + direction);
            }
            fields.add(field);
            directions.add(direction);
            return this;
        }

        public IndexSpec build() {
            return new IndexSpec(new ArrayList<>(fields), new ArrayList<>(directions));
        }
    }
}
