package co.elastic.policycheck.tree;

/**
 * The input bytes are not a well-formed policy document.
 */
public final class DocumentDecodeException extends PolicyCheckException {
    public static final String CODE = "decode_error";

    public DocumentDecodeException(String message) {
        super(CODE, message);
    }

    public DocumentDecodeException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
