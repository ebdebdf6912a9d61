package co.elastic.policycheck.api;

import co.elastic.policycheck.tree.PolicyCheckException;

/**
 * One side of a comparison could not be canonicalized. Carries the code of the underlying error.
 */
public final class PolicyComparisonException extends PolicyCheckException {
    private final PolicySide side;

    public PolicyComparisonException(PolicySide side, PolicyCheckException cause) {
        super(cause.code(), "failed to prepare " + side.label() + " policy: " + cause.getMessage(), cause);
        this.side = side;
    }

    public PolicySide side() {
        return side;
    }
}
