package com.tracelake.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QueryShapes Tests")
class QueryShapesTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private List<QueryShapes.Candidate> candidates(String command) throws IOException {
        return QueryShapes.candidates(objectMapper.readTree(command));
    }

    @Test
    @DisplayName("Should read filter and sort keys of a find")
    void shouldReadFindShape() throws IOException {
        List<QueryShapes.Candidate> candidates =
            candidates("{\"find\":\"orders\",\"filter\":{\"status\":\"A\"},\"sort\":{\"created\":-1}}");

        assertThat(candidates).extracting(c -> c.getSpec().toString())
            .containsExactly("{status: 1}", "{created: -1}", "{status: 1, created: -1}");
        assertThat(candidates).extracting(QueryShapes.Candidate::getType)
            .containsExactly("single_field", "sort", "compound_filter_sort");
    }

    @Test
    @DisplayName("Should skip logical operators and rank compound sorts lower")
    void shouldSkipLogicalOperators() throws IOException {
        List<QueryShapes.Candidate> candidates = candidates("{\"find\":\"orders\","
            + "\"filter\":{\"$or\":[{\"a\":1},{\"b\":2}],\"region\":\"eu\"},\"sort\":{\"a\":1,\"b\":-1}}");

        assertThat(candidates).extracting(c -> c.getSpec().toString())
            .containsExactly("{region: 1}", "{a: 1, b: -1}");
        assertThat(candidates.get(1).getPriority()).isEqualTo(QueryShapes.PRIORITY_MEDIUM);
    }

    @Test
    @DisplayName("Should read $match and $sort stages of a pipeline")
    void shouldReadAggregateShape() throws IOException {
        List<QueryShapes.Candidate> candidates = candidates("{\"aggregate\":\"events\",\"pipeline\":["
            + "{\"$match\":{\"type\":\"click\",\"$expr\":{}}},{\"$group\":{\"_id\":\"$user\"}},{\"$sort\":{\"ts\":-1}}]}");

        assertThat(candidates).extracting(c -> c.getSpec().toString()).containsExactly("{type: 1}", "{ts: -1}");
        assertThat(candidates).extracting(QueryShapes.Candidate::getType)
            .containsExactly("single_field", "aggregate_sort");
    }

    @Test
    @DisplayName("Should ignore sorts on computed values and other commands")
    void shouldIgnoreUnsupportedShapes() throws IOException {
        assertThat(candidates("{\"find\":\"docs\",\"sort\":{\"score\":{\"$meta\":\"textScore\"}}}")).isEmpty();
        assertThat(candidates("{\"getMore\":42,\"collection\":\"orders\"}")).isEmpty();
        assertThat(QueryShapes.candidates(null)).isEmpty();
    }

    @Test
    @DisplayName("Should treat leading keys as a prefix")
    void shouldDetectPrefixes() {
        IndexSpec compound = IndexSpec.builder().key("status", 1).key("created", -1).build();

        assertThat(IndexSpec.of("status", 1).isPrefixOf(compound)).isTrue();
        assertThat(IndexSpec.of("status", -1).isPrefixOf(compound)).isFalse();
        assertThat(IndexSpec.of("created", -1).isPrefixOf(compound)).isFalse();
        assertThat(compound.isPrefixOf(IndexSpec.of("status", 1))).isFalse();
    }
}
