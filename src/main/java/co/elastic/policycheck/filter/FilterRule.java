package co.elastic.policycheck.filter;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One entry of a rule table. Each rule acts on the value found at its dotted {@link #path()}; a rule whose
 * path is absent does nothing.
 */
public interface FilterRule {
    String path();

    static DeleteRule delete(String path) {
        return new DeleteRule(path, false, List.of());
    }

    /**
     * Deletes the value only when it is empty once {@code ignoredValues} are left out.
     */
    static DeleteRule deleteIfEmpty(String path, Object... ignoredValues) {
        return new DeleteRule(path, true, List.of(ignoredValues));
    }

    static RecurseIntoRule recurseInto(String path, FilterRule... rules) {
        return new RecurseIntoRule(path, List.of(rules));
    }

    static RecurseIntoMembersRule recurseIntoMembers(String path, FilterRule... rules) {
        return new RecurseIntoMembersRule(path, List.of(rules));
    }

    static RenameKeysRule renameKeys(String path, String regex, String replacement) {
        return new RenameKeysRule(path, Pattern.compile(regex), replacement);
    }

    static ReplaceValuesRule replaceValues(String path, String placeholder) {
        return new ReplaceValuesRule(path, placeholder);
    }

    /**
     * Removes the value at {@code path}, unless {@code onlyIfEmpty} is set and the value has content.
     */
    record DeleteRule(String path, boolean onlyIfEmpty, List<Object> ignoredValues) implements FilterRule {
        public DeleteRule {
            Objects.requireNonNull(path, "path");
            ignoredValues = List.copyOf(ignoredValues);
        }
    }

    /**
     * Applies {@code rules} to every element of the list at {@code path}. Elements must be maps.
     */
    record RecurseIntoRule(String path, List<FilterRule> rules) implements FilterRule {
        public RecurseIntoRule {
            Objects.requireNonNull(path, "path");
            rules = List.copyOf(rules);
        }
    }

    /**
     * Applies {@code rules} to every map value of the map at {@code path}.
     */
    record RecurseIntoMembersRule(String path, List<FilterRule> rules) implements FilterRule {
        public RecurseIntoMembersRule {
            Objects.requireNonNull(path, "path");
            rules = List.copyOf(rules);
        }
    }

    /**
     * Renames the keys of the map at {@code path} that match {@code pattern}.
     * The replacement may refer to capture groups.
     */
    record RenameKeysRule(String path, Pattern pattern, String replacement) implements FilterRule {
        public RenameKeysRule {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(replacement, "replacement");
        }
    }

    /**
     * Replaces the string, or each string of the list, at {@code path} with {@code placeholder}.
     */
    record ReplaceValuesRule(String path, String placeholder) implements FilterRule {
        public ReplaceValuesRule {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(placeholder, "placeholder");
        }
    }
}
