package de.mirkosertic.mcp.codeindex.hybrid;

import de.mirkosertic.mcp.codeindex.index.IndexedDocument;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchFiltersTest {

    private static Map<String, String> fields(final String path, final String language) {
        return Map.of(IndexedDocument.FIELD_PATH, path, IndexedDocument.FIELD_LANGUAGE, language);
    }

    @Test
    void testNoneMatchesEverything() {
        final Predicate<Map<String, String>> predicate = SearchFilters.none().toPredicate();

        assertThat(SearchFilters.none().isEmpty()).isTrue();
        assertThat(predicate.test(Map.of())).isTrue();
    }

    @Test
    void testBlankValuesAreIgnored() {
        assertThat(new SearchFilters("  ", "").isEmpty()).isTrue();
    }

    @Test
    void testMalformedGlobIsRejectedOnConstruction() {
        assertThatThrownBy(() -> new SearchFilters(null, "src/[a"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid path glob 'src/[a'");
    }

    @Test
    void testLanguageIsCaseInsensitive() {
        final Predicate<Map<String, String>> predicate = new SearchFilters("Java", null).toPredicate();

        assertThat(predicate.test(fields("A.java", "java"))).isTrue();
        assertThat(predicate.test(fields("a.py", "python"))).isFalse();
        assertThat(predicate.test(Map.of())).isFalse();
    }

    @Test
    void testGlobWithoutSeparatorMatchesFileName() {
        final Predicate<Map<String, String>> predicate = new SearchFilters(null, "*.java").toPredicate();

        assertThat(predicate.test(fields("src/main/java/Foo.java", "java"))).isTrue();
        assertThat(predicate.test(fields("src/main/java/foo.py", "python"))).isFalse();
        assertThat(predicate.test(Map.of())).isFalse();
    }

    @Test
    void testGlobWithSeparatorMatchesWholePath() {
        final Predicate<Map<String, String>> predicate = new SearchFilters(null, "src/**/*.py").toPredicate();

        assertThat(predicate.test(fields("src/pkg/mod.py", "python"))).isTrue();
        assertThat(predicate.test(fields("lib/pkg/mod.py", "python"))).isFalse();
    }

    @Test
    void testBothFiltersMustMatch() {
        final Predicate<Map<String, String>> predicate = new SearchFilters("python", "*.java").toPredicate();

        assertThat(predicate.test(fields("Foo.java", "java"))).isFalse();
    }

    @Test
    void testRenderIsStable() {
        assertThat(new SearchFilters("Java", "*.java").render()).isEqualTo("language=java;path=*.java");
        assertThat(SearchFilters.none().render()).isEqualTo("language=;path=");
    }
}
