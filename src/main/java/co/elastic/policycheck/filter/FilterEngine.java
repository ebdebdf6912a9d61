package co.elastic.policycheck.filter;

import co.elastic.policycheck.filter.FilterRule.DeleteRule;
import co.elastic.policycheck.filter.FilterRule.RecurseIntoMembersRule;
import co.elastic.policycheck.filter.FilterRule.RecurseIntoRule;
import co.elastic.policycheck.filter.FilterRule.RenameKeysRule;
import co.elastic.policycheck.filter.FilterRule.ReplaceValuesRule;
import co.elastic.policycheck.tree.DocumentShapeException;
import co.elastic.policycheck.tree.PolicyDocument;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies a rule table to a policy tree, rule by rule, each rule seeing the result of the previous ones.
 * Missing paths are skipped; a value of an unexpected kind raises {@link DocumentShapeException}.
 */
public final class FilterEngine {
    private FilterEngine() {}

    public static PolicyDocument apply(PolicyDocument document, List<FilterRule> rules) {
        for (var rule : rules) {
            var lookup = document.get(rule.path());
            if (!lookup.found()) {
                continue;
            }
            Object value = lookup.value();
            if (rule instanceof RecurseIntoRule recurse) {
                document.put(rule.path(), cleanElements(rule.path(), value, recurse.rules()));
            } else if (rule instanceof RecurseIntoMembersRule members) {
                document.put(rule.path(), cleanMembers(rule.path(), value, members.rules()));
            } else if (rule instanceof RenameKeysRule rename) {
                document.put(rule.path(), renameKeys(rule.path(), value, rename));
            } else if (rule instanceof ReplaceValuesRule replace) {
                if (value != null) {
                    document.put(rule.path(), replaceValues(rule.path(), value, replace.placeholder()));
                }
            } else if (rule instanceof DeleteRule delete) {
                if (delete.onlyIfEmpty() && !isEmpty(value, delete.ignoredValues())) {
                    continue;
                }
                document.delete(rule.path());
            } else {
                throw new IllegalArgumentException("Unsupported filter rule: " + rule);
            }
        }
        return document;
    }

    private static List<Object> cleanElements(String path, Object value, List<FilterRule> rules) {
        if (!(value instanceof List<?> list)) {
            throw DocumentShapeException.expected("list", path, value);
        }
        var cleaned = new ArrayList<Object>(list.size());
        for (var element : list) {
            if (!(element instanceof Map<?, ?> map)) {
                throw DocumentShapeException.expected("map", path + "[]", element);
            }
            cleaned.add(apply(new PolicyDocument(PolicyDocument.copyMap(map)), rules).root());
        }
        return cleaned;
    }

    private static Map<String, Object> cleanMembers(String path, Object value, List<FilterRule> rules) {
        if (!(value instanceof Map<?, ?> map)) {
            throw DocumentShapeException.expected("map", path, value);
        }
        var cleaned = new LinkedHashMap<String, Object>();
        for (var entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object member = entry.getValue();
            if (member == null) {
                cleaned.put(key, null);
            } else if (member instanceof Map<?, ?> memberMap) {
                cleaned.put(key, apply(new PolicyDocument(PolicyDocument.copyMap(memberMap)), rules).root());
            } else {
                throw DocumentShapeException.expected("map", path + "." + key, member);
            }
        }
        return cleaned;
    }

    private static Map<String, Object> renameKeys(String path, Object value, RenameKeysRule rule) {
        if (!(value instanceof Map<?, ?> map)) {
            throw DocumentShapeException.expected("map", path, value);
        }
        var renamed = new LinkedHashMap<String, Object>();
        for (var entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            var matcher = rule.pattern().matcher(key);
            if (matcher.find()) {
                key = matcher.replaceAll(rule.replacement());
            }
            renamed.put(key, entry.getValue());
        }
        return renamed;
    }

    private static Object replaceValues(String path, Object value, String placeholder) {
        if (value instanceof String) {
            return placeholder;
        }
        if (value instanceof List<?> list) {
            var replaced = new ArrayList<Object>(list.size());
            for (var item : list) {
                if (!(item instanceof String)) {
                    throw DocumentShapeException.expected("string", path + "[]", item);
                }
                replaced.add(placeholder);
            }
            return replaced;
        }
        throw DocumentShapeException.expected("string or list", path, value);
    }

    static boolean isEmpty(Object value, List<Object> ignoredValues) {
        if (value == null) {
            return true;
        }
        if (value instanceof List<?> list) {
            return list.stream().allMatch(item -> ignoredValues.stream().anyMatch(ignored -> Objects.equals(ignored, item)));
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }
}
