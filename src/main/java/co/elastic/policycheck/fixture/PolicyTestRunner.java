package co.elastic.policycheck.fixture;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the policy tests of a folder ({@code test-*.yml}), either asserting each downloaded policy against
 * its fixture or regenerating the fixtures. The policy of a test is looked up by the test name.
 */
public final class PolicyTestRunner {
    private static final Logger LOG = LoggerFactory.getLogger(PolicyTestRunner.class);
    private static final String TEST_PREFIX = "test-";
    private static final String TEST_EXTENSION = ".yml";

    private final ExpectedPolicyFixtures fixtures;
    private final boolean generate;

    public PolicyTestRunner(ExpectedPolicyFixtures fixtures, boolean generate) {
        this.fixtures = Objects.requireNonNull(fixtures, "fixtures");
        this.generate = generate;
    }

    public static List<Path> discoverTests(Path testFolder) throws IOException {
        try (var files = Files.list(testFolder)) {
            return files
                .filter(Files::isRegularFile)
                .filter(path -> {
                    String name = path.getFileName().toString();
                    return name.startsWith(TEST_PREFIX) && name.endsWith(TEST_EXTENSION);
                })
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new IOException("failed to look for test files in " + testFolder + ": " + ex.getMessage(), ex);
        }
    }

    public static String testName(Path testPath) {
        String fileName = testPath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    public List<PolicyTestResult> run(Path testFolder) throws IOException {
        var results = new ArrayList<PolicyTestResult>();
        for (Path test : discoverTests(testFolder)) {
            results.add(runTest(test));
        }
        return results;
    }

    PolicyTestResult runTest(Path testPath) {
        String name = testPath.getFileName().toString();
        String policyId = testName(testPath);
        try {
            if (generate) {
                fixtures.dumpExpected(testPath, policyId);
            } else {
                fixtures.assertExpected(testPath, policyId);
            }
            return PolicyTestResult.success(name);
        } catch (Exception ex) {
            LOG.debug("Policy test {} failed", name, ex);
            return PolicyTestResult.failure(name, ex.getMessage());
        }
    }
}
