package com.tracelake.normalization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracelake.config.TraceLakeSettings;
import com.tracelake.domain.EventKind;
import com.tracelake.domain.NormalizedEvent;
import com.tracelake.domain.RawSpan;
import com.tracelake.normalization.parsers.EventParser;
import com.tracelake.normalization.parsers.ParseContext;
import com.tracelake.normalization.parsers.ParseException;
import com.tracelake.normalization.parsers.ParserRegistry;
import com.tracelake.normalization.parsers.TimestampException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns one raw log line into at most one typed event.
 *
 * Blank lines, lines that do not start with {@code {} and well-formed entries
 * of no known kind yield an empty result and are not errors. A line that
 * starts a JSON object but cannot be decoded is malformed: it is counted under
 * the kind it resembles, or as unclassified. A decoded entry of a known kind
 * that fails to parse is counted as malformed (or dropped, for timestamp
 * failures). This method never throws for bad input.
 */
@Service
public class RecordNormalizer {

    private static final Logger log = LoggerFactory.getLogger(RecordNormalizer.class);

    private final EventKindDetector kindDetector;
    private final ParserRegistry parserRegistry;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final int sampleChars;

    // Metrics
    private final Map<EventKind, Counter> parsedCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> failedCounters = new ConcurrentHashMap<>();

    public RecordNormalizer(
            EventKindDetector kindDetector,
            ParserRegistry parserRegistry,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            TraceLakeSettings settings) {
        this.kindDetector = kindDetector;
        this.parserRegistry = parserRegistry;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.sampleChars = settings.getSampleChars();
    }

    /**
     * Normalize one line
     *
     * @param line the decoded line without its terminator
     * @param span where the line's bytes live in the source file
     * @param lineNumber 1-based line number, kept for provenance
     * @param counters per-run tallies to update
     * @return the event, or empty when the line is not an event or failed to parse
     */
    public Optional<NormalizedEvent> normalize(String line, RawSpan span, long lineNumber,
                                               NormalizationCounters counters) {
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.charAt(0) != '{') {
            return Optional.empty();
        }

        JsonNode entry;
        try {
            entry = objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            EventKind resembled = kindDetector.sniff(trimmed);
            counters.recordMalformed(resembled);
            if (resembled != null) {
                incrementFailedCounter(resembled.getValue(), "malformed");
                log.debug("Malformed {} line {}: {}", resembled, lineNumber, e.getOriginalMessage());
            } else {
                incrementFailedCounter(NormalizationCounters.UNCLASSIFIED, "malformed");
                log.debug("Malformed line {} of unknown kind: {}", lineNumber, e.getOriginalMessage());
            }
            return Optional.empty();
        }
        if (entry == null || !entry.isObject()) {
            return Optional.empty();
        }

        // 1. Detect the event kind
        EventKind kind = kindDetector.classify(entry);
        if (kind == null) {
            return Optional.empty();
        }

        // 2. Parse with the kind's parser
        EventParser parser = parserRegistry.getParser(kind);
        try {
            NormalizedEvent event = parser.parse(entry, new ParseContext(line, span, lineNumber, sample(line)));
            if (event == null) {
                return Optional.empty();
            }
            counters.recordProcessed(kind);
            incrementParsedCounter(kind);
            return Optional.of(event);

        } catch (TimestampException e) {
            counters.recordDropped(kind);
            incrementFailedCounter(kind.getValue(), "timestamp");
            log.debug("Dropped {} line {}: {}", kind, lineNumber, e.getMessage());
            return Optional.empty();

        } catch (ParseException e) {
            counters.recordMalformed(kind);
            incrementFailedCounter(kind.getValue(), "malformed");
            log.debug("Malformed {} line {}: {}", kind, lineNumber, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Best-effort prefix of the raw line stored for retrieval fallback
     */
    private String sample(String line) {
        if (sampleChars <= 0) {
            return null;
        }
        return line.length() <= sampleChars ? line : line.substring(0, sampleChars);
    }

    private void incrementParsedCounter(EventKind kind) {
        Counter counter = parsedCounters.computeIfAbsent(kind, k ->
            Counter.builder("tracelake.normalization.parsed")
                .tag("kind", k.getValue())
                .description("Number of successfully normalized events by kind")
                .register(meterRegistry)
        );
        counter.increment();
    }

    private void incrementFailedCounter(String kind, String reason) {
        Counter counter = failedCounters.computeIfAbsent(kind + ":" + reason, key ->
            Counter.builder("tracelake.normalization.failed")
                .tag("kind", kind)
                .tag("reason", reason)
                .description("Number of lines that failed to normalize, by kind")
                .register(meterRegistry)
        );
        counter.increment();
    }
}
