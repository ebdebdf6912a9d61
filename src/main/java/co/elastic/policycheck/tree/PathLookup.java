package co.elastic.policycheck.tree;

/**
 * Result of reading a dotted path. A missing path is a regular outcome, distinct from a present null.
 */
public record PathLookup(boolean found, Object value) {
    private static final PathLookup ABSENT = new PathLookup(false, null);

    public static PathLookup absent() {
        return ABSENT;
    }

    public static PathLookup of(Object value) {
        return new PathLookup(true, value);
    }
}
