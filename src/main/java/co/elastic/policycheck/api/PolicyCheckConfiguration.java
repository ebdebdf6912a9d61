package co.elastic.policycheck.api;

import co.elastic.policycheck.filter.FilterRule;
import co.elastic.policycheck.filter.PolicyRuleTable;
import java.util.List;
import java.util.Objects;

/**
 * Immutable settings of the canonicalization and diff engine.
 */
public record PolicyCheckConfiguration(
    List<FilterRule> rules,
    int contextLines,
    String expectedLabel,
    String foundLabel
) {
    public PolicyCheckConfiguration {
        rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        Objects.requireNonNull(expectedLabel, "expectedLabel");
        Objects.requireNonNull(foundLabel, "foundLabel");
        if (contextLines < 0) {
            throw new IllegalArgumentException("contextLines must not be negative: " + contextLines);
        }
    }

    public static PolicyCheckConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<FilterRule> rules = PolicyRuleTable.DEFAULT;
        private int contextLines = 1;
        private String expectedLabel = "want";
        private String foundLabel = "got";

        public Builder rules(List<FilterRule> rules) {
            this.rules = rules;
            return this;
        }

        public Builder contextLines(int contextLines) {
            this.contextLines = contextLines;
            return this;
        }

        public Builder expectedLabel(String expectedLabel) {
            this.expectedLabel = expectedLabel;
            return this;
        }

        public Builder foundLabel(String foundLabel) {
            this.foundLabel = foundLabel;
            return this;
        }

        public PolicyCheckConfiguration build() {
            return new PolicyCheckConfiguration(rules, contextLines, expectedLabel, foundLabel);
        }
    }
}
