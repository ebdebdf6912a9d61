package co.elastic.policycheck.api;

import java.util.Locale;

/**
 * Which of the two compared policies an error belongs to.
 */
public enum PolicySide {
    EXPECTED,
    FOUND;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
