package co.elastic.policycheck.tree;

import java.util.List;
import java.util.Map;

/**
 * Coarse kind of a tree value, used in shape error messages.
 */
public enum ValueKind {
    NULL("null"),
    MAP("map"),
    LIST("list"),
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("bool"),
    OTHER("scalar");

    private final String label;

    ValueKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ValueKind of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Map<?, ?>) {
            return MAP;
        }
        if (value instanceof List<?>) {
            return LIST;
        }
        if (value instanceof String) {
            return STRING;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        return OTHER;
    }
}
