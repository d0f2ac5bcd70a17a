package com.tracelake.analysis;

import com.tracelake.TestLogs;
import com.tracelake.TraceLakeFixture;
import com.tracelake.config.TraceLakeSettings;
import com.tracelake.ingestion.IngestRequest;
import com.tracelake.query.InvalidFilterException;
import com.tracelake.query.ParquetScanEngine;
import com.tracelake.query.QueryFilters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IndexSuggestionService Tests")
class IndexSuggestionServiceTest {

    private static final String FIND_SORTED =
        "{\"find\":\"orders\",\"filter\":{\"status\":\"A\"},\"sort\":{\"created\":-1}}";
    private static final String FIND_BY_EMAIL = "{\"find\":\"users\",\"filter\":{\"email\":\"a@b.c\"}}";
    private static final String GET_MORE = "{\"getMore\":42,\"collection\":\"orders\"}";

    @TempDir
    Path tempDir;

    private TraceLakeFixture fixture;
    private final List<String> lines = new ArrayList<>();

    private IndexSuggestionService service(Consumer<TraceLakeSettings> customizer) {
        fixture = new TraceLakeFixture(tempDir.resolve("dataset"), customizer);
        return new IndexSuggestionService(fixture.queryService(new ParquetScanEngine()), fixture.objectMapper,
            fixture.settings);
    }

    private void log(String ns, String hash, String plan, long durationMillis, String command, int times) {
        for (int i = 0; i < times; i++) {
            String date = String.format("2024-03-01T10:%02d:00.000+00:00", lines.size());
            lines.add(TestLogs.slowQuery(date, ns, hash, plan, durationMillis, command));
        }
    }

    private void ingest() throws IOException {
        fixture.coordinator().ingest(new IngestRequest(TestLogs.write(tempDir.resolve("mongod.log"), lines)));
    }

    @Test
    @DisplayName("Should suggest indexes for repeated slow collection scans")
    void shouldSuggestIndexesForCollectionScans() throws IOException {
        // Given a collection scan pattern with a filter and a sort, and an indexed pattern
        IndexSuggestionService service = service(settings -> { });
        log("shop.orders", "H1", "COLLSCAN", 300, FIND_SORTED, 3);
        log("shop.users", "H2", "IXSCAN { email: 1 }", 50, FIND_BY_EMAIL, 2);
        ingest();

        // When suggesting
        IndexSuggestionReport report = service.suggest(QueryFilters.none());

        // Then the compound index covers the filter, and the sort-only index stays separate
        CollectionIndexReport orders = report.getCollections().get("shop.orders");
        assertThat(orders.getSuggestions()).extracting(IndexSuggestion::getIndex)
            .containsExactly("{status: 1, created: -1}", "{created: -1}");
        IndexSuggestion compound = orders.getSuggestions().get(0);
        assertThat(compound.getType()).isEqualTo("compound");
        assertThat(compound.getCommand()).isEqualTo("db.orders.createIndex({status: 1, created: -1})");
        assertThat(compound.getOccurrences()).isEqualTo(3);
        assertThat(compound.getAvgDurationMs()).isEqualTo(300);
        assertThat(compound.getInefficiencyRatio()).isEqualTo(100.0);
        assertThat(compound.getSelectivityPct()).isEqualTo(1.0);
        assertThat(compound.getImpactScore()).isEqualTo(90_000);
        assertThat(compound.getJustification())
            .isEqualTo("3 COLLSCAN executions scanned ~1000 docs in 300 ms without an index covering "
                + "{status: 1, created: -1}.");
        assertThat(orders.getCollscanExecutions()).isEqualTo(3);
        assertThat(orders.getSampleQueries()).hasSize(1);
        assertThat(orders.getSampleQueries().get(0)).contains("\"created\":-1");

        CollectionIndexReport users = report.getCollections().get("shop.users");
        assertThat(users.getSuggestions()).isEmpty();
        assertThat(users.getIxscanExecutions()).isEqualTo(2);
        assertThat(users.getReviews()).singleElement()
            .satisfies(review -> assertThat(review.getReason()).startsWith("Index already present"));

        assertThat(report.getTopSuggestions()).hasSize(2);
        assertThat(report.getTotalSuggestions()).isEqualTo(2);
        assertThat(report.getTotalCollscanExecutions()).isEqualTo(3);
        assertThat(report.getAvgDocsExamined()).isEqualTo(1000.0);
        assertThat(report.getDatasetVersion()).isEqualTo(1);
        assertThat(report.isTruncated()).isFalse();
    }

    @Test
    @DisplayName("Should only suggest for patterns that ran often enough")
    void shouldRequireMinimumOccurrences() throws IOException {
        IndexSuggestionService service = service(settings -> { });
        log("shop.orders", "H1", "COLLSCAN", 300, TestLogs.FIND_BY_STATUS, 2);
        log("shop.orders", "H3", "COLLSCAN", 300, GET_MORE, 1);
        ingest();

        CollectionIndexReport orders = service.suggest(QueryFilters.none()).getCollections().get("shop.orders");

        // Then two runs are not enough, and the command without a filter is left for review
        assertThat(orders.getSuggestions()).isEmpty();
        assertThat(orders.getCollscanExecutions()).isEqualTo(3);
        assertThat(orders.getReviews()).singleElement().satisfies(review -> {
            assertThat(review.getReason()).startsWith("Collection scan with no plain filter or sort");
            assertThat(review.getExecutions()).isEqualTo(1);
        });
    }

    @Test
    @DisplayName("Should honour configured thresholds")
    void shouldApplyConfiguredThresholds() throws IOException {
        // Given fast scans, which the default duration threshold ignores
        IndexSuggestionService defaults = service(settings -> { });
        log("shop.orders", "H1", "COLLSCAN", 1, TestLogs.FIND_BY_STATUS, 3);
        ingest();
        assertThat(defaults.suggest(QueryFilters.none()).getTotalSuggestions()).isZero();

        // When lowering the thresholds
        IndexSuggestionService relaxed = service(settings -> {
            settings.setSuggestionMinOccurrences(1);
            settings.setSuggestionMinAvgDurationMs(0);
        });

        // Then the same dataset yields a suggestion
        assertThat(relaxed.suggest(QueryFilters.none()).getTopSuggestions())
            .extracting(IndexSuggestion::getIndex).containsExactly("{status: 1}");
    }

    @Test
    @DisplayName("Should return an empty report before the first ingest")
    void shouldReportNothingForEmptyDataset() {
        IndexSuggestionReport report = service(settings -> { }).suggest(null);

        assertThat(report.getCollections()).isEmpty();
        assertThat(report.getTopSuggestions()).isEmpty();
        assertThat(report.getAvgDocsExamined()).isZero();
        assertThat(report.getDatasetVersion()).isZero();
    }

    @Test
    @DisplayName("Should reject filters slow queries do not have")
    void shouldRejectForeignFilters() {
        IndexSuggestionService service = service(settings -> { });

        assertThatThrownBy(() -> service.suggest(QueryFilters.builder().user("alice").build()))
            .isInstanceOf(InvalidFilterException.class);
    }
}
