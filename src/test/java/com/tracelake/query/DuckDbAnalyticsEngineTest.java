package com.tracelake.query;

import com.tracelake.domain.EventKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DuckDbAnalyticsEngine Tests")
class DuckDbAnalyticsEngineTest {

    private static final List<Path> FILES = List.of(Path.of("/data/slow_queries/2024/03/01/chunk_000001.parquet"));

    @Mock
    private DataSource dataSource;

    @Nested
    @DisplayName("SQL translation")
    class SqlTranslation {

        @Test
        @DisplayName("Should rank aggregates by the kind's metric, then by group")
        void shouldTranslateAggregate() {
            List<Object> params = new ArrayList<>();
            QuerySpec spec = QuerySpec.aggregate(EventKind.SLOW_QUERY, Grouping.NAMESPACE,
                QueryFilters.builder().database("shop").minDurationMs(100L).build(), 25, true);

            String sql = DuckDbAnalyticsEngine.toSql(spec, FILES, params);

            assertThat(sql)
                .startsWith("SELECT COALESCE(CAST(\"namespace\" AS VARCHAR), 'unknown') AS \"group\", COUNT(*)")
                .contains("read_parquet(['/data/slow_queries/2024/03/01/chunk_000001.parquet'], union_by_name = true)")
                .contains("WHERE \"database\" = ? AND \"duration_ms\" >= ?")
                .contains("quantile_cont(\"duration_ms\", 0.95) AS \"p95_duration_ms\"")
                .endsWith("GROUP BY 1 ORDER BY \"total_duration_ms\" DESC, \"group\" ASC LIMIT 25");
            assertThat(params).containsExactly("shop", 100L);
        }

        @Test
        @DisplayName("Should bind every value instead of inlining it")
        void shouldBindFilterValues() {
            List<Object> params = new ArrayList<>();
            QuerySpec spec = QuerySpec.search(EventKind.AUTH,
                QueryFilters.builder().user("x' OR '1'='1").timeRange(10, 20).build(), 5);

            String sql = DuckDbAnalyticsEngine.toSql(spec, FILES, params);

            assertThat(sql).doesNotContain("x' OR").contains("\"ts_epoch\" BETWEEN ? AND ?").contains("\"user\" = ?")
                .endsWith("ORDER BY \"ts_epoch\" DESC, \"record_key\" ASC LIMIT 5");
            assertThat(params).containsExactly(10L, 20L, "x' OR '1'='1");
        }

        @Test
        @DisplayName("Should keep rows with no database when excluding system databases")
        void shouldTranslateSystemDatabaseExclusion() {
            List<Object> params = new ArrayList<>();
            QuerySpec spec = QuerySpec.aggregate(EventKind.AUTH, Grouping.USER,
                QueryFilters.builder().excludeSystemDatabases(true).build(), 10, false);

            String sql = DuckDbAnalyticsEngine.toSql(spec, FILES, params);

            assertThat(sql).contains("(\"database\" IS NULL OR \"database\" NOT IN (?, ?, ?))")
                .contains("ORDER BY \"count\" DESC");
            assertThat(params).containsExactly("admin", "local", "config");
        }

        @Test
        @DisplayName("Should escape quotes in partition paths")
        void shouldEscapePaths() {
            QuerySpec spec = QuerySpec.trend(EventKind.CONNECTION, Grouping.EVENT, QueryFilters.none(),
                TrendBucketing.FIVE_MINUTES);

            String sql = DuckDbAnalyticsEngine.toSql(spec, List.of(Path.of("/data/o'brien/chunk.parquet")),
                new ArrayList<>());

            assertThat(sql).contains("'/data/o''brien/chunk.parquet'")
                .startsWith("SELECT CAST(floor(\"ts_epoch\" / 300.0) * 300 AS BIGINT) AS \"bucket\"")
                .endsWith("GROUP BY 1, 2 ORDER BY \"bucket\" ASC, \"group\" ASC")
                .doesNotContain("total_duration_ms");
        }
    }

    @Test
    @DisplayName("Should report the engine unavailable when no connection can be opened")
    void shouldReportUnavailableConnection() throws SQLException {
        // Given a data source that cannot open connections
        when(dataSource.getConnection()).thenThrow(new SQLException("native library missing"));
        DuckDbAnalyticsEngine engine = new DuckDbAnalyticsEngine(new JdbcTemplate(dataSource));
        QuerySpec spec = QuerySpec.search(EventKind.SLOW_QUERY, QueryFilters.none(), 10);

        // When running a query, then the failure names the engine and its kind
        assertThatThrownBy(() -> engine.execute(spec, FILES))
            .isInstanceOf(QueryExecutionException.class)
            .hasRootCauseMessage("native library missing")
            .satisfies(e -> {
                QueryExecutionException failure = (QueryExecutionException) e;
                assertThat(failure.getKind()).isEqualTo(QueryExecutionException.FailureKind.ENGINE_UNAVAILABLE);
                assertThat(failure.getEngine()).isEqualTo(DuckDbAnalyticsEngine.NAME);
            });
    }

    @Nested
    @DisplayName("Execution on embedded DuckDB")
    class Execution {

        @TempDir
        Path tempDir;

        private SingleConnectionDataSource dataSource;
        private DuckDbAnalyticsEngine engine;
        private final ParquetScanEngine fallback = new ParquetScanEngine();
        private List<Path> slowQueries;
        private List<Path> auths;

        @BeforeEach
        void setUp() {
            dataSource = new SingleConnectionDataSource("jdbc:duckdb:", true);
            engine = new DuckDbAnalyticsEngine(new JdbcTemplate(dataSource));
            SamplePartitions partitions = new SamplePartitions(tempDir);
            slowQueries = partitions.slowQueryFiles();
            auths = partitions.authFiles();
        }

        @AfterEach
        void tearDown() {
            dataSource.destroy();
        }

        @Test
        @DisplayName("Should produce the same aggregate rows as the fallback engine")
        void shouldMatchFallbackAggregates() {
            QuerySpec slow = QuerySpec.aggregate(EventKind.SLOW_QUERY, Grouping.NAMESPACE, QueryFilters.none(), 10, false);
            QuerySpec auth = QuerySpec.aggregate(EventKind.AUTH, Grouping.USER, QueryFilters.none(), 10, false);

            assertThat(engine.execute(slow, slowQueries)).isEqualTo(fallback.execute(slow, slowQueries));
            assertThat(engine.execute(auth, auths)).isEqualTo(fallback.execute(auth, auths));
        }

        @Test
        @DisplayName("Should produce the same trend rows as the fallback engine")
        void shouldMatchFallbackTrends() {
            QuerySpec trend = QuerySpec.trend(EventKind.SLOW_QUERY, Grouping.DATABASE,
                QueryFilters.builder().excludeSystemDatabases(true).build(), TrendBucketing.HOUR);

            assertThat(engine.execute(trend, slowQueries)).isEqualTo(fallback.execute(trend, slowQueries));
        }

        @Test
        @DisplayName("Should order search results like the fallback engine")
        void shouldMatchFallbackSearchOrder() {
            QuerySpec search = QuerySpec.search(EventKind.SLOW_QUERY,
                QueryFilters.builder().minDurationMs(50L).build(), 3);

            List<Map<String, Object>> rows = engine.execute(search, slowQueries);

            assertThat(rows).extracting(row -> row.get("record_key"))
                .containsExactlyElementsOf(fallback.execute(search, slowQueries).stream()
                    .map(row -> row.get("record_key")).toList());
        }

        @Test
        @DisplayName("Should compute the 95th percentile of durations")
        void shouldComputePercentiles() {
            QuerySpec spec = QuerySpec.aggregate(EventKind.SLOW_QUERY, Grouping.NAMESPACE,
                QueryFilters.builder().namespace("shop.orders").build(), 10, true);

            List<Map<String, Object>> rows = engine.execute(spec, slowQueries);

            assertThat(rows).hasSize(1);
            assertThat(((Number) rows.get(0).get(ResultColumns.P95_DURATION_MS)).doubleValue()).isEqualTo(195.0);
        }

        @Test
        @DisplayName("Should wrap engine failures with the failing SQL")
        void shouldWrapFailures() {
            QuerySpec spec = QuerySpec.search(EventKind.SLOW_QUERY, QueryFilters.none(), 10);

            assertThatThrownBy(() -> engine.execute(spec, List.of(tempDir.resolve("missing.parquet"))))
                .isInstanceOf(QueryExecutionException.class)
                .satisfies(e -> assertThat(((QueryExecutionException) e).getQuery()).contains("missing.parquet"))
                .satisfies(e -> assertThat(((QueryExecutionException) e).getKind())
                    .isEqualTo(QueryExecutionException.FailureKind.NO_DATA));
        }
    }
}
