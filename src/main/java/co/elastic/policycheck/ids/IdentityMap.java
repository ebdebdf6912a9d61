package co.elastic.policycheck.ids;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Original component identifiers mapped to their canonical replacements, for one document.
 */
public final class IdentityMap {
    private static final String IDENTIFIER_CHARS = "A-Za-z0-9_./-";

    private final Map<String, String> replacements = new LinkedHashMap<>();
    private Pattern referencePattern;

    /**
     * Records a replacement. An identifier that is already mapped keeps its first replacement.
     *
     * @return {@code false} when {@code original} was already mapped to a different identifier
     */
    public boolean record(String original, String canonical) {
        var previous = replacements.putIfAbsent(original, canonical);
        if (previous == null) {
            referencePattern = null;
        }
        return previous == null || previous.equals(canonical);
    }

    public Optional<String> canonicalFor(String original) {
        return Optional.ofNullable(replacements.get(original));
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(replacements);
    }

    public boolean isEmpty() {
        return replacements.isEmpty();
    }

    public int size() {
        return replacements.size();
    }

    /**
     * Replaces every occurrence of a recorded identifier in {@code text} in a single pass.
     *
     * <p>An occurrence only counts when it is not glued to other identifier characters, so
     * {@code batch/a} does not touch {@code batch/a-2}. Replaced text is never scanned again.
     */
    public String rewriteReferences(String text) {
        if (replacements.isEmpty()) {
            return text;
        }
        Matcher matcher = referencePattern().matcher(text);
        var result = new StringBuilder(text.length());
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacements.get(matcher.group())));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private Pattern referencePattern() {
        if (referencePattern == null) {
            var originals = new ArrayList<>(replacements.keySet());
            originals.sort(Comparator.comparingInt(String::length).reversed());
            var alternatives = originals.stream().map(Pattern::quote).collect(Collectors.joining("|"));
            referencePattern = Pattern.compile(
                "(?<![" + IDENTIFIER_CHARS + "])(?:" + alternatives + ")(?![" + IDENTIFIER_CHARS + "])"
            );
        }
        return referencePattern;
    }
}
