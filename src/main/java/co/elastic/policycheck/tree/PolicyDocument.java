package co.elastic.policycheck.tree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable policy tree addressed with dotted paths ({@code agent.protection.signing_key}).
 *
 * <p>Maps are {@link LinkedHashMap}s with string keys, lists are {@link ArrayList}s, everything else is a
 * scalar. The tree never shares substructure: {@link PolicyYaml#parse(String)} expands aliases into copies.
 *
 * <p>Path resolution tries the remaining path as a literal key before splitting it on the next dot, so a
 * key that itself contains dots ({@code ssl.ca_trusted_fingerprint}) is still addressable.
 */
public final class PolicyDocument {
    private final Map<String, Object> root;

    public PolicyDocument(Map<String, Object> root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public static PolicyDocument empty() {
        return new PolicyDocument(new LinkedHashMap<>());
    }

    public Map<String, Object> root() {
        return root;
    }

    public PathLookup get(String path) {
        var location = locate(path, false);
        if (location == null || !location.parent().containsKey(location.key())) {
            return PathLookup.absent();
        }
        return PathLookup.of(location.parent().get(location.key()));
    }

    public void put(String path, Object value) {
        var location = locate(path, true);
        location.parent().put(location.key(), value);
    }

    /**
     * Removes the value at {@code path}.
     *
     * @return {@code false} when nothing was stored there
     */
    public boolean delete(String path) {
        var location = locate(path, false);
        if (location == null || !location.parent().containsKey(location.key())) {
            return false;
        }
        location.parent().remove(location.key());
        return true;
    }

    public PolicyDocument copy() {
        return new PolicyDocument(copyMap(root));
    }

    private Location locate(String path, boolean createMissing) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("path must not be empty");
        }
        Map<String, Object> current = root;
        String remaining = path;
        int consumed = 0;
        while (true) {
            if (current.containsKey(remaining)) {
                return new Location(current, remaining);
            }
            int dot = remaining.indexOf('.');
            if (dot < 0) {
                return new Location(current, remaining);
            }
            String head = remaining.substring(0, dot);
            consumed += dot + 1;
            Object child = current.get(head);
            if (child == null) {
                if (!createMissing) {
                    return null;
                }
                child = new LinkedHashMap<String, Object>();
                current.put(head, child);
            }
            if (!(child instanceof Map<?, ?>)) {
                throw DocumentShapeException.expected("map", path.substring(0, consumed - 1), child);
            }
            current = asStringMap(child);
            remaining = remaining.substring(dot + 1);
        }
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asStringMap(Object value) {
        return (Map<String, Object>) value;
    }

    /**
     * Deep copy of a tree value built from maps, lists and immutable scalars.
     */
    public static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap(map);
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (var item : list) {
                copy.add(copyValue(item));
            }
            return copy;
        }
        return value;
    }

    public static Map<String, Object> copyMap(Map<?, ?> map) {
        var copy = new LinkedHashMap<String, Object>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), copyValue(v)));
        return copy;
    }

    private record Location(Map<String, Object> parent, String key) {}
}
