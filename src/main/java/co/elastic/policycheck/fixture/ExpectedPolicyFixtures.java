package co.elastic.policycheck.fixture;

import co.elastic.policycheck.api.PolicyComparator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Golden fixtures of policy tests: each {@code test-<name>.yml} has its canonical expected policy next to
 * it in {@code test-<name>.expected}.
 */
public final class ExpectedPolicyFixtures {
    private static final Logger LOG = LoggerFactory.getLogger(ExpectedPolicyFixtures.class);
    static final String EXPECTED_EXTENSION = ".expected";

    private final PolicySource source;
    private final PolicyComparator comparator;

    public ExpectedPolicyFixtures(PolicySource source, PolicyComparator comparator) {
        this.source = Objects.requireNonNull(source, "source");
        this.comparator = Objects.requireNonNull(comparator, "comparator");
    }

    public static Path expectedPathFor(Path testPath) {
        String fileName = testPath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return testPath.resolveSibling(base + EXPECTED_EXTENSION);
    }

    /**
     * Downloads the policy and writes its canonical form as the expected fixture of {@code testPath}.
     */
    public Path dumpExpected(Path testPath, String policyId) throws IOException {
        byte[] policy = download(policyId);
        byte[] canonical = comparator.canonicalizer().canonicalize(policy);
        Path expectedPath = expectedPathFor(testPath);
        Files.write(expectedPath, canonical);
        LOG.debug("Wrote expected policy {}", expectedPath);
        return expectedPath;
    }

    /**
     * Downloads the policy and compares it with the expected fixture of {@code testPath}.
     *
     * @throws PolicyMismatchException if the policies differ
     */
    public void assertExpected(Path testPath, String policyId) throws IOException {
        byte[] policy = download(policyId);
        Path expectedPath = expectedPathFor(testPath);
        byte[] expected;
        try {
            expected = Files.readAllBytes(expectedPath);
        } catch (NoSuchFileException ex) {
            throw new IOException("failed to read expected policy: " + expectedPath + " does not exist", ex);
        }
        String diff = comparator.compare(expected, policy);
        if (!diff.isEmpty()) {
            throw new PolicyMismatchException(diff);
        }
    }

    private byte[] download(String policyId) throws IOException {
        try {
            return source.downloadPolicy(policyId);
        } catch (IOException ex) {
            throw new IOException("failed to download policy \"" + policyId + "\": " + ex.getMessage(), ex);
        }
    }
}
