package com.codesentry.core.technique;

import com.codesentry.core.model.Occurrence;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FilePredicates}.
 */
class FilePredicatesTest {

    @Test
    void hasExtension_matchesCaseInsensitively() {
        FilePredicate predicate = FilePredicates.hasExtension("ts", ".java");

        assertThat(predicate.test("src/a.ts")).isTrue();
        assertThat(predicate.test("src/B.JAVA")).isTrue();
        assertThat(predicate.test("src/a.js")).isFalse();
        assertThat(predicate.test("Makefile")).isFalse();
    }

    @Test
    void matchesGlob_matchesRelativePath() {
        FilePredicate predicate = FilePredicates.matchesGlob("src/**/*.ts");

        assertThat(predicate.test("src/app/a.ts")).isTrue();
        assertThat(predicate.test("lib/a.ts")).isFalse();
    }

    @Test
    void excludeTests_rejectsTestSources() {
        FilePredicate predicate = FilePredicates.excludeTests();

        assertThat(predicate.test("src/app/service.ts")).isTrue();
        assertThat(predicate.test("src/app/service.test.ts")).isFalse();
        assertThat(predicate.test("src/test/java/com/x/FooTest.java")).isFalse();
        assertThat(predicate.test("__tests__/a.js")).isFalse();
    }

    @Test
    void combinators_composePredicates() {
        FilePredicate ts = FilePredicates.hasExtension("ts");
        FilePredicate java = FilePredicates.hasExtension("java");

        assertThat(ts.or(java).test("A.java")).isTrue();
        assertThat(ts.and(FilePredicates.excludeTests()).test("a.spec.ts")).isFalse();
        assertThat(ts.negate().test("a.ts")).isFalse();
        assertThat(FilePredicates.all().test("anything")).isTrue();
        assertThat(FilePredicates.none().test("anything")).isFalse();
    }

    @Test
    void technique_withoutPredicate_appliesToEveryFile() {
        Technique technique = new AbstractTechnique() {
            @Override
            public String getId() {
                return "any-file";
            }

            @Override
            public List<Occurrence> apply(String content, String relPath,
                    Object syntaxTree, String fullPath, ExecutionContext context) {
                return List.of();
            }
        };

        assertThat(technique.appliesTo("whatever.bin")).isTrue();
    }
}
