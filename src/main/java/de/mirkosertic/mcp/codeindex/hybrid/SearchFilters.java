package de.mirkosertic.mcp.codeindex.hybrid;

import de.mirkosertic.mcp.codeindex.index.IndexedDocument;
import org.jspecify.annotations.Nullable;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.PatternSyntaxException;

/**
 * Filters on document metadata. Local sources apply them before truncating their candidate
 * lists, the orchestrator applies them again to the fused list.
 *
 * @param language case-insensitive match on the {@code language} field
 * @param pathGlob glob on the {@code path} field; a glob without a directory separator is
 *                 matched against the file name only
 * @throws IllegalArgumentException if {@code pathGlob} is not a valid glob
 */
public record SearchFilters(@Nullable String language, @Nullable String pathGlob) {

    private static final SearchFilters NONE = new SearchFilters(null, null);

    public SearchFilters {
        language = language != null && !language.isBlank() ? language.trim() : null;
        pathGlob = pathGlob != null && !pathGlob.isBlank() ? pathGlob.trim() : null;
        if (pathGlob != null) {
            compileGlob(pathGlob);
        }
    }

    private static PathMatcher compileGlob(final String glob) {
        try {
            return FileSystems.getDefault().getPathMatcher("glob:" + glob);
        } catch (final PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid path glob '" + glob + "': " + e.getDescription(), e);
        }
    }

    public static SearchFilters none() {
        return NONE;
    }

    public boolean isEmpty() {
        return language == null && pathGlob == null;
    }

    /**
     * Compiles the filters into a predicate over document fields.
     */
    public Predicate<Map<String, String>> toPredicate() {
        if (isEmpty()) {
            return fields -> true;
        }

        final PathMatcher matcher = pathGlob != null ? compileGlob(pathGlob) : null;
        final boolean fileNameOnly = pathGlob != null && pathGlob.indexOf('/') < 0;

        return fields -> {
            if (language != null && !language.equalsIgnoreCase(fields.get(IndexedDocument.FIELD_LANGUAGE))) {
                return false;
            }
            if (matcher != null) {
                final String path = fields.get(IndexedDocument.FIELD_PATH);
                if (path == null) {
                    return false;
                }
                try {
                    final Path candidate = Paths.get(path);
                    final Path target = fileNameOnly ? candidate.getFileName() : candidate;
                    return target != null && matcher.matches(target);
                } catch (final InvalidPathException e) {
                    return false;
                }
            }
            return true;
        };
    }

    /**
     * Stable text form used in cache fingerprints.
     */
    public String render() {
        return "language=" + (language != null ? language.toLowerCase(Locale.ROOT) : "")
                + ";path=" + (pathGlob != null ? pathGlob : "");
    }
}
