package co.elastic.policycheck.fixture;

import co.elastic.policycheck.tree.PolicyCheckException;

/**
 * The downloaded policy does not match its expected fixture.
 */
public final class PolicyMismatchException extends PolicyCheckException {
    public static final String CODE = "policy_mismatch";

    private final String diff;

    public PolicyMismatchException(String diff) {
        super(CODE, "unexpected content in policy: " + diff);
        this.diff = diff;
    }

    public String diff() {
        return diff;
    }
}
