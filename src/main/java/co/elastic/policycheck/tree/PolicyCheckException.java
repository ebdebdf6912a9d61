package co.elastic.policycheck.tree;

/**
 * Base error of the policy check engine, carrying a short machine readable code.
 */
public class PolicyCheckException extends RuntimeException {
    private final String code;

    public PolicyCheckException(String code, String message) {
        super(message);
        this.code = code;
    }

    public PolicyCheckException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
