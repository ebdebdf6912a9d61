package co.elastic.policycheck.fixture;

/**
 * Outcome of a single policy test case.
 */
public record PolicyTestResult(String name, boolean success, String error) {
    public static PolicyTestResult success(String name) {
        return new PolicyTestResult(name, true, null);
    }

    public static PolicyTestResult failure(String name, String error) {
        return new PolicyTestResult(name, false, error);
    }
}
