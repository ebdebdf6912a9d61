package co.elastic.policycheck.api;

import co.elastic.policycheck.tree.PolicyCheckException;
import co.elastic.policycheck.tree.PolicyYaml;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares an expected policy with a found one after canonicalizing both.
 */
public final class PolicyComparator {
    private static final Logger LOG = LoggerFactory.getLogger(PolicyComparator.class);

    private final PolicyCheckConfiguration configuration;
    private final PolicyCanonicalizer canonicalizer;

    public PolicyComparator() {
        this(PolicyCheckConfiguration.defaults());
    }

    public PolicyComparator(PolicyCheckConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.canonicalizer = new PolicyCanonicalizer(configuration);
    }

    public PolicyCanonicalizer canonicalizer() {
        return canonicalizer;
    }

    /**
     * Returns an empty string when both policies are equivalent, a unified diff otherwise.
     *
     * @throws PolicyComparisonException if either policy cannot be canonicalized
     */
    public String compare(byte[] expected, byte[] found) {
        String want = prepare(PolicySide.EXPECTED, expected);
        String got = prepare(PolicySide.FOUND, found);
        LOG.trace("Expected policy after cleaning:\n{}", want);
        LOG.trace("Found policy after cleaning:\n{}", got);

        if (want.equals(got)) {
            return "";
        }
        List<String> wantLines = splitLines(want);
        List<String> gotLines = splitLines(got);
        var patch = DiffUtils.diff(wantLines, gotLines);
        List<String> diff = UnifiedDiffUtils.generateUnifiedDiff(
            configuration.expectedLabel(),
            configuration.foundLabel(),
            wantLines,
            patch,
            configuration.contextLines()
        );
        return String.join("\n", diff) + "\n";
    }

    private String prepare(PolicySide side, byte[] policy) {
        try {
            return canonicalizer.canonicalize(PolicyYaml.decode(policy));
        } catch (PolicyCheckException ex) {
            throw new PolicyComparisonException(side, ex);
        }
    }

    private static List<String> splitLines(String text) {
        return Arrays.asList(text.split("\n"));
    }
}
