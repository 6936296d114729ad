package com.codesentry.core.technique.impl;

import com.codesentry.core.technique.Technique;
import com.codesentry.core.technique.TechniqueRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link BuiltInTechniques}.
 */
class BuiltInTechniquesTest {

    @Test
    void registerAll_registersEveryBuiltIn() {
        TechniqueRegistry registry = BuiltInTechniques.registerAll(new TechniqueRegistry());

        assertThat(registry.list()).extracting(Technique::getId)
            .containsExactly("duplicate-files", "todo-comments", "oversized-file");
        assertThat(registry.globalTechniques()).extracting(Technique::getId).containsExactly("duplicate-files");
    }

    @Test
    void create_appliesSettings() {
        List<Technique> techniques = BuiltInTechniques.create(Map.of(
            "oversized-file", Map.of("maxLines", 42),
            "todo-comments", Map.of("markers", List.of("XXX"))
        ));

        assertThat(techniques).filteredOn(t -> t instanceof OversizedFileTechnique)
            .singleElement()
            .satisfies(t -> assertThat(((OversizedFileTechnique) t).maxLines()).isEqualTo(42));
        assertThat(techniques).filteredOn(t -> t instanceof TodoCommentTechnique)
            .singleElement()
            .satisfies(t -> assertThat(t.getDescription()).contains("XXX"));
    }

    @Test
    void create_stringSettings_areParsed() {
        List<Technique> techniques = BuiltInTechniques.create(Map.of(
            "oversized-file", Map.of("maxLines", "100")
        ));

        assertThat(techniques).filteredOn(t -> t instanceof OversizedFileTechnique)
            .singleElement()
            .satisfies(t -> assertThat(((OversizedFileTechnique) t).maxLines()).isEqualTo(100));
    }
}
