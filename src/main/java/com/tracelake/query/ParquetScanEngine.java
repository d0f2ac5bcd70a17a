package com.tracelake.query;

import com.tracelake.domain.AuthEvent;
import com.tracelake.domain.ConnectionEvent;
import com.tracelake.domain.EventKind;
import com.tracelake.storage.columnar.ParquetFiles;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.filter2.compat.FilterCompat;
import org.apache.parquet.filter2.predicate.FilterApi;
import org.apache.parquet.filter2.predicate.FilterPredicate;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.io.api.Binary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.function.Consumer;

/**
 * Fallback engine: scans partition files in the JVM with parquet-avro.
 *
 * Equality, range and minimum predicates are pushed down to the Parquet
 * reader for row-group skipping and re-checked on every record. Percentiles
 * are not supported.
 */
@Component
public class ParquetScanEngine implements AnalyticsEngine {

    public static final String NAME = "parquet-scan";

    private static final Logger logger = LoggerFactory.getLogger(ParquetScanEngine.class);

    private static final Comparator<Map<String, Object>> NEWEST_FIRST =
        Comparator.<Map<String, Object>>comparingLong(row -> ((Number) row.get("ts_epoch")).longValue())
            .reversed()
            .thenComparing(row -> (String) row.get("record_key"));

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean supportsPercentiles() {
        return false;
    }

    @Override
    public List<Map<String, Object>> execute(QuerySpec spec, List<Path> partitionFiles) {
        if (spec.isWithPercentiles()) {
            throw new QueryExecutionException("Percentiles are not supported",
                QueryExecutionException.FailureKind.ENGINE_UNAVAILABLE, NAME);
        }
        return switch (spec.getShape()) {
            case AGGREGATE -> aggregate(spec, partitionFiles);
            case TREND -> trend(spec, partitionFiles);
            case SEARCH -> search(spec, partitionFiles);
        };
    }

    private List<Map<String, Object>> aggregate(QuerySpec spec, List<Path> files) {
        EventKind kind = spec.getKind();
        Map<String, Accumulator> groups = new HashMap<>();
        scan(spec, files, record ->
            groups.computeIfAbsent(groupKey(spec.getGrouping(), record), k -> new Accumulator()).add(kind, record));

        String rankColumn = ResultColumns.rankColumn(kind);
        List<Map<String, Object>> rows = new ArrayList<>(groups.size());
        for (Map.Entry<String, Accumulator> entry : groups.entrySet()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(ResultColumns.GROUP, entry.getKey());
            entry.getValue().writeTo(kind, row);
            rows.add(row);
        }
        rows.sort(Comparator.<Map<String, Object>>comparingLong(row -> ((Number) row.get(rankColumn)).longValue())
            .reversed()
            .thenComparing(row -> (String) row.get(ResultColumns.GROUP)));
        return rows.size() > spec.getLimit() ? new ArrayList<>(rows.subList(0, spec.getLimit())) : rows;
    }

    private List<Map<String, Object>> trend(QuerySpec spec, List<Path> files) {
        EventKind kind = spec.getKind();
        Grouping grouping = spec.getGrouping();
        TrendBucketing bucketing = spec.getBucketing();
        Map<BucketKey, Accumulator> buckets = new HashMap<>();
        scan(spec, files, record -> {
            long bucket = bucketing.bucketStart(ParquetFiles.longValue(record, "ts_epoch"));
            String group = grouping == null ? null : groupKey(grouping, record);
            buckets.computeIfAbsent(new BucketKey(bucket, group), k -> new Accumulator()).add(kind, record);
        });

        List<BucketKey> keys = new ArrayList<>(buckets.keySet());
        keys.sort(Comparator.comparingLong((BucketKey k) -> k.bucket)
            .thenComparing(k -> k.group, Comparator.nullsFirst(Comparator.naturalOrder())));
        List<Map<String, Object>> rows = new ArrayList<>(keys.size());
        for (BucketKey key : keys) {
            Accumulator acc = buckets.get(key);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(ResultColumns.BUCKET, key.bucket);
            if (grouping != null) {
                row.put(ResultColumns.GROUP, key.group);
            }
            row.put(ResultColumns.COUNT, acc.count);
            if (kind == EventKind.SLOW_QUERY) {
                row.put(ResultColumns.TOTAL_DURATION_MS, acc.totalDuration);
            }
            rows.add(row);
        }
        return rows;
    }

    private List<Map<String, Object>> search(QuerySpec spec, List<Path> files) {
        int limit = spec.getLimit();
        // min-heap on the search order keeps the newest rows
        PriorityQueue<Map<String, Object>> top = new PriorityQueue<>(NEWEST_FIRST.reversed());
        scan(spec, files, record -> {
            top.add(toRow(record));
            if (top.size() > limit) {
                top.poll();
            }
        });
        List<Map<String, Object>> rows = new ArrayList<>(top);
        rows.sort(NEWEST_FIRST);
        return rows;
    }

    private void scan(QuerySpec spec, List<Path> files, Consumer<GenericRecord> consumer) {
        List<QueryFilters.Condition> conditions = spec.getFilters().conditions();
        FilterCompat.Filter filter = pushdown(conditions);
        for (Path file : files) {
            try (ParquetReader<GenericRecord> reader = ParquetFiles.openReader(file, filter)) {
                GenericRecord record;
                while ((record = reader.read()) != null) {
                    if (matchesAll(record, conditions)) {
                        consumer.accept(record);
                    }
                }
            } catch (NoSuchFileException e) {
                throw new QueryExecutionException("Partition " + file.getFileName() + " is missing",
                    QueryExecutionException.FailureKind.NO_DATA, NAME, e);
            } catch (IOException e) {
                throw new QueryExecutionException("Failed to scan partition " + file.getFileName(),
                    QueryExecutionException.FailureKind.ENGINE_FAILURE, NAME, e);
            }
        }
        logger.debug("Scanned {} partitions for {}", files.size(), spec);
    }

    static FilterCompat.Filter pushdown(List<QueryFilters.Condition> conditions) {
        FilterPredicate predicate = null;
        for (QueryFilters.Condition condition : conditions) {
            FilterPredicate next = switch (condition.getOperator()) {
                case EQUALS -> FilterApi.eq(FilterApi.binaryColumn(condition.getColumn()),
                    Binary.fromString((String) condition.getValues().get(0)));
                case AT_LEAST -> FilterApi.gtEq(FilterApi.longColumn(condition.getColumn()),
                    (Long) condition.getValues().get(0));
                case BETWEEN -> FilterApi.and(
                    FilterApi.gtEq(FilterApi.longColumn(condition.getColumn()), (Long) condition.getValues().get(0)),
                    FilterApi.ltEq(FilterApi.longColumn(condition.getColumn()), (Long) condition.getValues().get(1)));
                case NOT_IN_OR_NULL -> null;
            };
            if (next != null) {
                predicate = predicate == null ? next : FilterApi.and(predicate, next);
            }
        }
        return predicate == null ? FilterCompat.NOOP : FilterCompat.get(predicate);
    }

    private static boolean matchesAll(GenericRecord record, List<QueryFilters.Condition> conditions) {
        for (QueryFilters.Condition condition : conditions) {
            if (!condition.matches(value(record, condition.getColumn()))) {
                return false;
            }
        }
        return true;
    }

    static String groupKey(Grouping grouping, GenericRecord record) {
        if (grouping.isComposite()) {
            return Grouping.patternKey(ParquetFiles.string(record, "namespace"),
                ParquetFiles.string(record, "plan_summary"), ParquetFiles.string(record, "query_hash"));
        }
        Object value = value(record, grouping.getValue());
        return value == null ? Grouping.UNKNOWN_GROUP : value.toString();
    }

    private static Object value(GenericRecord record, String column) {
        return record.getSchema().getField(column) == null ? null : record.get(column);
    }

    private static Map<String, Object> toRow(GenericRecord record) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (Schema.Field field : record.getSchema().getFields()) {
            Object value = record.get(field.pos());
            row.put(field.name(), value instanceof CharSequence ? value.toString() : value);
        }
        return row;
    }

    private static final class BucketKey {
        private final long bucket;
        private final String group;

        BucketKey(long bucket, String group) {
            this.bucket = bucket;
            this.group = group;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof BucketKey)) {
                return false;
            }
            BucketKey other = (BucketKey) o;
            return bucket == other.bucket && Objects.equals(group, other.group);
        }

        @Override
        public int hashCode() {
            return Objects.hash(bucket, group);
        }
    }

    /**
     * Running metrics of one group
     */
    private static final class Accumulator {
        private long count;
        private long totalDuration;
        private long maxDuration;
        private long docsExamined;
        private long docsReturned;
        private long keysExamined;
        private long failures;
        private long successes;
        private long accepted;
        private long ended;

        void add(EventKind kind, GenericRecord record) {
            count++;
            switch (kind) {
                case SLOW_QUERY -> {
                    long duration = ParquetFiles.longValue(record, "duration_ms");
                    totalDuration += duration;
                    maxDuration = count == 1 ? duration : Math.max(maxDuration, duration);
                    docsExamined += ParquetFiles.longValue(record, "docs_examined");
                    docsReturned += ParquetFiles.longValue(record, "docs_returned");
                    keysExamined += ParquetFiles.longValue(record, "keys_examined");
                }
                case AUTH -> {
                    String result = ParquetFiles.string(record, "result");
                    if (AuthEvent.RESULT_FAILURE.equals(result)) {
                        failures++;
                    } else if (AuthEvent.RESULT_SUCCESS.equals(result)) {
                        successes++;
                    }
                }
                case CONNECTION -> {
                    String event = ParquetFiles.string(record, "event");
                    if (ConnectionEvent.EVENT_ACCEPTED.equals(event)) {
                        accepted++;
                    } else if (ConnectionEvent.EVENT_ENDED.equals(event)) {
                        ended++;
                    }
                }
            }
        }

        void writeTo(EventKind kind, Map<String, Object> row) {
            row.put(ResultColumns.COUNT, count);
            switch (kind) {
                case SLOW_QUERY -> {
                    row.put(ResultColumns.TOTAL_DURATION_MS, totalDuration);
                    row.put(ResultColumns.AVG_DURATION_MS, (double) totalDuration / count);
                    row.put(ResultColumns.MAX_DURATION_MS, maxDuration);
                    row.put(ResultColumns.TOTAL_DOCS_EXAMINED, docsExamined);
                    row.put(ResultColumns.TOTAL_DOCS_RETURNED, docsReturned);
                    row.put(ResultColumns.TOTAL_KEYS_EXAMINED, keysExamined);
                }
                case AUTH -> {
                    row.put(ResultColumns.FAILURES, failures);
                    row.put(ResultColumns.SUCCESSES, successes);
                }
                case CONNECTION -> {
                    row.put(ResultColumns.ACCEPTED, accepted);
                    row.put(ResultColumns.ENDED, ended);
                }
            }
        }
    }
}
