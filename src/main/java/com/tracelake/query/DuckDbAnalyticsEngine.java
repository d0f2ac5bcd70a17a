package com.tracelake.query;

import com.tracelake.domain.AuthEvent;
import com.tracelake.domain.ConnectionEvent;
import com.tracelake.domain.EventKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Primary engine: translates a query into DuckDB SQL over
 * {@code read_parquet} of the pruned partition files.
 *
 * Filter values are bound as statement parameters; only column names from the
 * closed filter set and escaped file paths are inlined.
 */
@Component
public class DuckDbAnalyticsEngine implements AnalyticsEngine {

    public static final String NAME = "duckdb";

    private static final Logger logger = LoggerFactory.getLogger(DuckDbAnalyticsEngine.class);

    private final JdbcTemplate jdbcTemplate;

    public DuckDbAnalyticsEngine(@Qualifier("duckDbJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean supportsPercentiles() {
        return true;
    }

    @Override
    public List<Map<String, Object>> execute(QuerySpec spec, List<Path> partitionFiles) {
        List<Object> params = new ArrayList<>();
        String sql = toSql(spec, partitionFiles, params);
        logger.debug("Executing DuckDB query over {} partitions: {}", partitionFiles.size(), sql);
        try {
            return jdbcTemplate.query(sql, rs -> {
                List<Map<String, Object>> rows = new ArrayList<>();
                ResultSetMetaData metaData = rs.getMetaData();
                int columnCount = metaData.getColumnCount();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= columnCount; i++) {
                        row.put(metaData.getColumnLabel(i), rs.getObject(i));
                    }
                    rows.add(row);
                }
                return rows;
            }, params.toArray());
        } catch (DataAccessResourceFailureException e) {
            throw new QueryExecutionException("DuckDB connection failed: " + e.getMostSpecificCause().getMessage(),
                QueryExecutionException.FailureKind.ENGINE_UNAVAILABLE, NAME, sql, e);
        } catch (DataAccessException e) {
            QueryExecutionException.FailureKind kind = anyMissing(partitionFiles)
                ? QueryExecutionException.FailureKind.NO_DATA
                : QueryExecutionException.FailureKind.ENGINE_FAILURE;
            throw new QueryExecutionException("DuckDB query failed: " + e.getMostSpecificCause().getMessage(),
                kind, NAME, sql, e);
        }
    }

    private static boolean anyMissing(List<Path> partitionFiles) {
        for (Path file : partitionFiles) {
            if (!Files.isRegularFile(file)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Build the SQL text for a query, appending bound values to {@code params}
     */
    static String toSql(QuerySpec spec, List<Path> partitionFiles, List<Object> params) {
        String from = " FROM " + source(partitionFiles);
        String where = where(spec.getFilters().conditions(), params);
        EventKind kind = spec.getKind();

        switch (spec.getShape()) {
            case AGGREGATE: {
                String rank = ResultColumns.rankColumn(kind);
                return "SELECT " + groupExpression(spec.getGrouping()) + " AS \"group\", "
                    + metricColumns(kind, spec.isWithPercentiles())
                    + from + where
                    + " GROUP BY 1"
                    + " ORDER BY \"" + rank + "\" DESC, \"group\" ASC"
                    + " LIMIT " + spec.getLimit();
            }
            case TREND: {
                long width = spec.getBucketing().getSeconds();
                StringBuilder select = new StringBuilder("SELECT CAST(floor(\"ts_epoch\" / ")
                    .append(width).append(".0) * ").append(width).append(" AS BIGINT) AS \"bucket\"");
                if (spec.getGrouping() != null) {
                    select.append(", ").append(groupExpression(spec.getGrouping())).append(" AS \"group\"");
                }
                select.append(", COUNT(*) AS \"count\"");
                if (kind == EventKind.SLOW_QUERY) {
                    select.append(", CAST(SUM(\"duration_ms\") AS BIGINT) AS \"total_duration_ms\"");
                }
                String groupBy = spec.getGrouping() == null ? " GROUP BY 1 ORDER BY \"bucket\" ASC"
                    : " GROUP BY 1, 2 ORDER BY \"bucket\" ASC, \"group\" ASC";
                return select + from + where + groupBy;
            }
            case SEARCH:
                return "SELECT *" + from + where
                    + " ORDER BY \"ts_epoch\" DESC, \"record_key\" ASC"
                    + " LIMIT " + spec.getLimit();
            default:
                throw new IllegalStateException("Unhandled query shape " + spec.getShape());
        }
    }

    private static String source(List<Path> partitionFiles) {
        StringJoiner files = new StringJoiner(", ", "[", "]");
        for (Path file : partitionFiles) {
            files.add("'" + file.toAbsolutePath().toString().replace("'", "''") + "'");
        }
        return "read_parquet(" + files + ", union_by_name = true)";
    }

    private static String where(List<QueryFilters.Condition> conditions, List<Object> params) {
        if (conditions.isEmpty()) {
            return "";
        }
        StringJoiner clauses = new StringJoiner(" AND ", " WHERE ", "");
        for (QueryFilters.Condition condition : conditions) {
            String column = quote(condition.getColumn());
            List<Object> values = condition.getValues();
            switch (condition.getOperator()) {
                case EQUALS -> {
                    clauses.add(column + " = ?");
                    params.add(values.get(0));
                }
                case AT_LEAST -> {
                    clauses.add(column + " >= ?");
                    params.add(values.get(0));
                }
                case BETWEEN -> {
                    clauses.add(column + " BETWEEN ? AND ?");
                    params.add(values.get(0));
                    params.add(values.get(1));
                }
                case NOT_IN_OR_NULL -> {
                    StringJoiner placeholders = new StringJoiner(", ", "(", ")");
                    for (Object value : values) {
                        placeholders.add("?");
                        params.add(value);
                    }
                    clauses.add("(" + column + " IS NULL OR " + column + " NOT IN " + placeholders + ")");
                }
            }
        }
        return clauses.toString();
    }

    private static String groupExpression(Grouping grouping) {
        if (grouping.isComposite()) {
            return "concat_ws('" + Grouping.PATTERN_SEPARATOR + "', \"namespace\", \"plan_summary\", \"query_hash\")";
        }
        return "COALESCE(CAST(" + quote(grouping.getValue()) + " AS VARCHAR), '" + Grouping.UNKNOWN_GROUP + "')";
    }

    private static String metricColumns(EventKind kind, boolean withPercentiles) {
        StringBuilder sb = new StringBuilder("COUNT(*) AS \"count\"");
        switch (kind) {
            case SLOW_QUERY -> {
                sb.append(", CAST(SUM(\"duration_ms\") AS BIGINT) AS \"total_duration_ms\"");
                sb.append(", CAST(SUM(\"duration_ms\") AS DOUBLE) / COUNT(*) AS \"avg_duration_ms\"");
                sb.append(", CAST(MAX(\"duration_ms\") AS BIGINT) AS \"max_duration_ms\"");
                sb.append(", CAST(SUM(\"docs_examined\") AS BIGINT) AS \"total_docs_examined\"");
                sb.append(", CAST(SUM(\"docs_returned\") AS BIGINT) AS \"total_docs_returned\"");
                sb.append(", CAST(SUM(\"keys_examined\") AS BIGINT) AS \"total_keys_examined\"");
                if (withPercentiles) {
                    sb.append(", quantile_cont(\"duration_ms\", 0.95) AS \"p95_duration_ms\"");
                }
            }
            case AUTH -> {
                sb.append(", ").append(countWhere("result", AuthEvent.RESULT_FAILURE, ResultColumns.FAILURES));
                sb.append(", ").append(countWhere("result", AuthEvent.RESULT_SUCCESS, ResultColumns.SUCCESSES));
            }
            case CONNECTION -> {
                sb.append(", ").append(countWhere("event", ConnectionEvent.EVENT_ACCEPTED, ResultColumns.ACCEPTED));
                sb.append(", ").append(countWhere("event", ConnectionEvent.EVENT_ENDED, ResultColumns.ENDED));
            }
        }
        return sb.toString();
    }

    private static String countWhere(String column, String value, String alias) {
        return "CAST(SUM(CASE WHEN " + quote(column) + " = '" + value + "' THEN 1 ELSE 0 END) AS BIGINT) AS "
            + quote(alias);
    }

    private static String quote(String identifier) {
        return "\"" + identifier + "\"";
    }
}
