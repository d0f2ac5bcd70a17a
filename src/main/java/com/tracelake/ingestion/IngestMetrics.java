package com.tracelake.ingestion;

import com.tracelake.domain.EventKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Metrics collector for ingest runs
 */
@Component
public class IngestMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter runsCompleted;
    private final Counter runsAborted;
    private final Counter lockRejections;
    private final Counter linesRead;
    private final Counter oversizedLines;
    private final Timer runDuration;
    private final Timer partitionWriteLatency;
    private final Map<EventKind, Counter> rowsWritten = new ConcurrentHashMap<>();
    private final Map<EventKind, Counter> partitionsWritten = new ConcurrentHashMap<>();

    public IngestMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        runsCompleted = Counter.builder("tracelake.ingest.runs.completed")
            .description("Total number of ingest runs published")
            .register(meterRegistry);

        runsAborted = Counter.builder("tracelake.ingest.runs.aborted")
            .description("Total number of ingest runs aborted and rolled back")
            .register(meterRegistry);

        lockRejections = Counter.builder("tracelake.ingest.lock.rejected")
            .description("Total number of ingest requests rejected because the dataset was locked")
            .register(meterRegistry);

        linesRead = Counter.builder("tracelake.ingest.lines.read")
            .description("Total number of source lines read")
            .register(meterRegistry);

        oversizedLines = Counter.builder("tracelake.ingest.lines.oversized")
            .description("Total number of source lines skipped for exceeding the line size limit")
            .register(meterRegistry);

        runDuration = Timer.builder("tracelake.ingest.duration")
            .description("Duration of ingest runs")
            .register(meterRegistry);

        partitionWriteLatency = Timer.builder("tracelake.ingest.partition.write.latency")
            .description("Latency of writing one partition with its offset segment")
            .register(meterRegistry);
    }

    public void recordCompleted(long durationMillis) {
        runsCompleted.increment();
        runDuration.record(durationMillis, TimeUnit.MILLISECONDS);
    }

    public void recordAborted(long durationMillis) {
        runsAborted.increment();
        runDuration.record(durationMillis, TimeUnit.MILLISECONDS);
    }

    public void recordLockRejected() {
        lockRejections.increment();
    }

    public void recordLinesRead(long count) {
        linesRead.increment(count);
    }

    public void recordOversizedLine() {
        oversizedLines.increment();
    }

    public void recordPartitionWritten(EventKind kind, long rows, long millis) {
        partitionWriteLatency.record(millis, TimeUnit.MILLISECONDS);
        partitionsWritten.computeIfAbsent(kind, k ->
            Counter.builder("tracelake.ingest.partitions.written")
                .tag("kind", k.getValue())
                .description("Number of partition files written by kind")
                .register(meterRegistry)
        ).increment();
        rowsWritten.computeIfAbsent(kind, k ->
            Counter.builder("tracelake.ingest.rows.written")
                .tag("kind", k.getValue())
                .description("Number of rows written to partitions by kind")
                .register(meterRegistry)
        ).increment(rows);
    }
}
