package com.tracelake.normalization;

import com.tracelake.TestLogs;
import com.tracelake.TraceLakeFixture;
import com.tracelake.config.TraceLakeSettings;
import com.tracelake.domain.AuthEvent;
import com.tracelake.domain.ConnectionEvent;
import com.tracelake.domain.EventKind;
import com.tracelake.domain.NormalizedEvent;
import com.tracelake.domain.RawSpan;
import com.tracelake.domain.SlowQueryEvent;
import com.tracelake.normalization.parsers.AuthParser;
import com.tracelake.normalization.parsers.ConnectionParser;
import com.tracelake.normalization.parsers.ParserRegistry;
import com.tracelake.normalization.parsers.SlowQueryParser;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RecordNormalizer Tests")
class RecordNormalizerTest {

    private static final String DATE = "2024-03-01T10:15:30.123+00:00";
    private static final RawSpan SPAN = new RawSpan(7, 1024, 300);

    @TempDir
    Path tempDir;

    private TraceLakeFixture fixture;
    private RecordNormalizer normalizer;
    private NormalizationCounters counters;

    @BeforeEach
    void setUp() {
        fixture = new TraceLakeFixture(tempDir);
        normalizer = fixture.normalizer;
        counters = new NormalizationCounters();
    }

    @Test
    @DisplayName("Should normalize a slow query with its hash as record key")
    void shouldNormalizeSlowQuery() {
        String line = TestLogs.slowQuery(DATE, "shop.orders", "ABC123", "COLLSCAN", 250);

        Optional<NormalizedEvent> result = normalizer.normalize(line, SPAN, 42, counters);

        assertThat(result).isPresent();
        SlowQueryEvent event = (SlowQueryEvent) result.get();
        assertThat(event.getKind()).isEqualTo(EventKind.SLOW_QUERY);
        assertThat(event.getRecordKey()).isEqualTo("ABC123");
        assertThat(event.getDatabase()).isEqualTo("shop");
        assertThat(event.getCollection()).isEqualTo("orders");
        assertThat(event.getNamespace()).isEqualTo("shop.orders");
        assertThat(event.getPlanSummary()).isEqualTo("COLLSCAN");
        assertThat(event.getOperation()).isEqualTo("find");
        assertThat(event.getDurationMs()).isEqualTo(250);
        assertThat(event.getDocsExamined()).isEqualTo(1000);
        assertThat(event.getDocsReturned()).isEqualTo(10);
        assertThat(event.getTsEpoch()).isEqualTo(1709288130L);
        assertThat(event.getSpan()).isEqualTo(SPAN);
        assertThat(event.getLineNumber()).isEqualTo(42);
        assertThat(event.getSample()).isEqualTo(line);
        assertThat(counters.getProcessed(EventKind.SLOW_QUERY)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should normalize authentication success and failure")
    void shouldNormalizeAuth() {
        AuthEvent success = (AuthEvent) normalizer.normalize(
            TestLogs.auth(DATE, "alice", "admin", true, "10.0.0.5:51234"), SPAN, 1, counters).orElseThrow();
        AuthEvent failure = (AuthEvent) normalizer.normalize(
            TestLogs.auth(DATE, "alice", "admin", false, "10.0.0.5:51234"), SPAN, 2, counters).orElseThrow();

        assertThat(success.getResult()).isEqualTo(AuthEvent.RESULT_SUCCESS);
        assertThat(success.getUser()).isEqualTo("alice");
        assertThat(success.getDatabase()).isEqualTo("admin");
        assertThat(success.getMechanism()).isEqualTo("SCRAM-SHA-256");
        assertThat(success.getRemoteAddress()).isEqualTo("10.0.0.5:51234");
        assertThat(failure.isFailure()).isTrue();
        assertThat(failure.getRecordKey()).isNotEqualTo(success.getRecordKey());
        assertThat(counters.getProcessed(EventKind.AUTH)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should share a connection key across client ports")
    void shouldNormalizeConnections() {
        ConnectionEvent first = (ConnectionEvent) normalizer.normalize(
            TestLogs.connection(DATE, true, "10.0.0.5:51234"), SPAN, 1, counters).orElseThrow();
        ConnectionEvent second = (ConnectionEvent) normalizer.normalize(
            TestLogs.connection(DATE, true, "10.0.0.5:60000"), SPAN, 2, counters).orElseThrow();

        assertThat(first.getEvent()).isEqualTo(ConnectionEvent.EVENT_ACCEPTED);
        assertThat(first.getConnectionCount()).isEqualTo(3);
        assertThat(first.getRecordKey()).isEqualTo(second.getRecordKey());
    }

    @Test
    @DisplayName("Should skip lines that are not events without counting errors")
    void shouldSkipNonEvents() {
        assertThat(normalizer.normalize("", SPAN, 1, counters)).isEmpty();
        assertThat(normalizer.normalize("plain text line", SPAN, 2, counters)).isEmpty();
        assertThat(normalizer.normalize("{\"t\":{\"$date\":\"" + DATE + "\"},\"c\":\"STORAGE\",\"msg\":\"Checkpoint\"}",
            SPAN, 3, counters)).isEmpty();

        assertThat(counters.parseErrors()).isZero();
        assertThat(counters.totalProcessed()).isZero();
    }

    @Test
    @DisplayName("Should count an undecodable line of unknown kind as unclassified")
    void shouldCountUnclassifiedMalformedLine() {
        // Given a line that opens a JSON object but resembles no event kind
        String line = "{\"t\": garbage";

        // When normalizing it
        Optional<NormalizedEvent> result = normalizer.normalize(line, SPAN, 4, counters);

        // Then it is a parse error in the unclassified bucket
        assertThat(result).isEmpty();
        assertThat(counters.getUnclassifiedMalformed()).isEqualTo(1);
        assertThat(counters.parseErrors()).isEqualTo(1);
        assertThat(counters.snapshot().get(NormalizationCounters.UNCLASSIFIED)).containsEntry("malformed", 1L);
        assertThat(fixture.meterRegistry.find("tracelake.normalization.failed")
            .tag("kind", NormalizationCounters.UNCLASSIFIED).tag("reason", "malformed").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should count a broken line that resembles a slow query as malformed")
    void shouldCountMalformedSlowQuery() {
        Optional<NormalizedEvent> result =
            normalizer.normalize(TestLogs.truncatedSlowQuery(DATE), SPAN, 5, counters);

        assertThat(result).isEmpty();
        assertThat(counters.getMalformed(EventKind.SLOW_QUERY)).isEqualTo(1);
        assertThat(counters.parseErrors()).isEqualTo(1);
        assertThat(fixture.meterRegistry.find("tracelake.normalization.failed")
            .tag("kind", "slow_queries").tag("reason", "malformed").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should drop classified lines without a timestamp")
    void shouldDropMissingTimestamp() {
        String line = "{\"c\":\"COMMAND\",\"msg\":\"Slow query\",\"attr\":{\"ns\":\"shop.orders\",\"durationMillis\":5}}";

        assertThat(normalizer.normalize(line, SPAN, 6, counters)).isEmpty();
        assertThat(counters.getDropped(EventKind.SLOW_QUERY)).isEqualTo(1);
        assertThat(counters.parseErrors()).isZero();
    }

    @Test
    @DisplayName("Should truncate the stored sample to the configured size")
    void shouldTruncateSample() {
        TraceLakeSettings settings = TraceLakeSettings.forDataset(tempDir);
        settings.setSampleChars(20);
        RecordKeyGenerator keyGenerator = new RecordKeyGenerator();
        RecordNormalizer shortSamples = new RecordNormalizer(new EventKindDetector(),
            new ParserRegistry(List.of(new SlowQueryParser(keyGenerator, fixture.objectMapper),
                new AuthParser(keyGenerator), new ConnectionParser(keyGenerator))),
            fixture.objectMapper, new SimpleMeterRegistry(), settings);
        String line = TestLogs.slowQuery(DATE, "shop.orders", "ABC123", "COLLSCAN", 250);

        NormalizedEvent event = shortSamples.normalize(line, SPAN, 1, counters).orElseThrow();

        assertThat(event.getSample()).isEqualTo(line.substring(0, 20));
    }
}
