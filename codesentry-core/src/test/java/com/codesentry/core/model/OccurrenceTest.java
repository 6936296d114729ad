package com.codesentry.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Occurrence}.
 */
class OccurrenceTest {

    @Test
    void constructor_nullKind_throws() {
        assertThatThrownBy(() -> new Occurrence(null, Severity.INFO, "m", "a.ts", 1, 1, "t"))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("kind");
    }

    @Test
    void constructor_nullSourceTechnique_throws() {
        assertThatThrownBy(() -> new Occurrence("k", Severity.INFO, "m", "a.ts", 1, 1, null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void constructor_nonPositiveLocation_isDropped() {
        Occurrence occurrence = new Occurrence("k", Severity.INFO, null, null, 0, -2, "t");

        assertThat(occurrence.line()).isNull();
        assertThat(occurrence.column()).isNull();
        assertThat(occurrence.message()).isEmpty();
        assertThat(occurrence.filePath()).isEmpty();
        assertThat(occurrence.hasLocation()).isFalse();
    }

    @Test
    void json_omitsMissingLocation() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        String json = mapper.writeValueAsString(Occurrence.at("k", Severity.WARNING, "m", "a.ts", "t"));

        assertThat(json).doesNotContain("\"line\"").doesNotContain("\"column\"").contains("\"severity\":\"WARNING\"");
        assertThat(mapper.readValue(json, Occurrence.class))
            .isEqualTo(Occurrence.at("k", Severity.WARNING, "m", "a.ts", "t"));
    }
}
