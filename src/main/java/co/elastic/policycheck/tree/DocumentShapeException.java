package co.elastic.policycheck.tree;

/**
 * A path was expected to hold a map or a list but holds another kind of value.
 */
public final class DocumentShapeException extends PolicyCheckException {
    public static final String CODE = "shape_error";

    public DocumentShapeException(String message) {
        super(CODE, message);
    }

    public static DocumentShapeException expected(String expectedKind, String path, Object found) {
        return new DocumentShapeException(
            "expected " + expectedKind + " at '" + path + "', found " + ValueKind.of(found).label()
        );
    }
}
