package com.codesentry.core.technique.impl;

import com.codesentry.core.model.Occurrence;
import com.codesentry.core.model.Severity;
import com.codesentry.core.technique.ExecutionContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TodoCommentTechnique}.
 */
class TodoCommentTechniqueTest {

    private final TodoCommentTechnique technique = new TodoCommentTechnique();
    private final ExecutionContext context = ExecutionContext.of("/project", List.of(), Map.of());

    private List<Occurrence> apply(String content) {
        return technique.apply(content, "src/a.ts", null, "/project/src/a.ts", context);
    }

    @Test
    void apply_lineComment_reportsLineAndColumn() {
        List<Occurrence> occurrences = apply("""
            const a = 1;
            const b = 2;
            // TODO: remove
            """);

        assertThat(occurrences).singleElement().satisfies(o -> {
            assertThat(o.kind()).isEqualTo(TodoCommentTechnique.KIND);
            assertThat(o.severity()).isEqualTo(Severity.INFO);
            assertThat(o.line()).isEqualTo(3);
            assertThat(o.column()).isEqualTo(4);
            assertThat(o.filePath()).isEqualTo("src/a.ts");
            assertThat(o.sourceTechnique()).isEqualTo("todo-comments");
            assertThat(o.message()).contains("TODO: remove");
        });
    }

    @Test
    void apply_markerInStringLiteral_isIgnored() {
        assertThat(apply("const s = \"TODO: not a comment\";\nconst t = '// TODO';\n")).isEmpty();
    }

    @Test
    void apply_trailingComment_isReported() {
        assertThat(apply("call(\"x\"); // FIXME later\n"))
            .singleElement()
            .satisfies(o -> assertThat(o.message()).startsWith("FIXME"));
    }

    @Test
    void apply_multiLineBlockComment_reportsInnerLines() {
        List<Occurrence> occurrences = apply("""
            /*
             * Service entry point.
             * TODO: validate input
             */
            function main() {}
            """);

        assertThat(occurrences).extracting(Occurrence::line).containsExactly(3);
    }

    @Test
    void apply_markerAfterBlockCommentEnds_isIgnored() {
        assertThat(apply("/* note */ const TODO = 1;\n")).isEmpty();
    }

    @Test
    void apply_markerAsPartOfWord_isIgnored() {
        assertThat(apply("// TODOS are tracked elsewhere\n")).isEmpty();
    }

    @Test
    void apply_emptyContent_returnsNothing() {
        assertThat(apply("")).isEmpty();
        assertThat(apply(null)).isEmpty();
    }

    @Test
    void filePredicate_acceptsSourcesAndSkipsTests() {
        assertThat(technique.appliesTo("src/a.ts")).isTrue();
        assertThat(technique.appliesTo("src/Main.java")).isTrue();
        assertThat(technique.appliesTo("src/a.test.ts")).isFalse();
        assertThat(technique.appliesTo("README.md")).isFalse();
    }

    @Test
    void customMarkers_replaceDefaults() {
        TodoCommentTechnique custom = new TodoCommentTechnique(List.of("HACK"), List.of("py", "ts"));

        List<Occurrence> occurrences = custom.apply("// HACK here\n// TODO there\n", "a.ts", null, "a.ts", context);

        assertThat(occurrences).extracting(Occurrence::line).containsExactly(1);
        assertThat(custom.appliesTo("a.py")).isTrue();
        assertThat(custom.getDescription()).contains("HACK");
    }
}
