package co.elastic.policycheck.cli;

import co.elastic.policycheck.api.PolicyComparator;
import co.elastic.policycheck.fixture.DirectoryPolicySource;
import co.elastic.policycheck.fixture.ExpectedPolicyFixtures;
import co.elastic.policycheck.fixture.PolicyTestResult;
import co.elastic.policycheck.fixture.PolicyTestRunner;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "test",
    description = "Run the policy tests (test-*.yml) of a folder against dumped policies.",
    mixinStandardHelpOptions = true
)
final class PolicyTestCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "TEST_FOLDER", description = "Folder holding test-*.yml files.")
    private Path testFolder;

    @CommandLine.Option(
        names = "--policies",
        required = true,
        description = "Folder with the downloaded policies, one <test-name>.yml per test."
    )
    private Path policies;

    @CommandLine.Option(names = {"-g", "--generate"}, description = "Write expected fixtures instead of asserting them.")
    private boolean generate;

    @CommandLine.Option(names = "--json", description = "Print JSON results.")
    private boolean json;

    @Override
    public Integer call() throws Exception {
        if (!Files.isDirectory(testFolder)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Not a directory: " + testFolder);
        }
        var fixtures = new ExpectedPolicyFixtures(new DirectoryPolicySource(policies), new PolicyComparator());
        List<PolicyTestResult> results = new PolicyTestRunner(fixtures, generate).run(testFolder);

        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        if (results.isEmpty()) {
            err.println("No policy tests found under " + testFolder);
            err.flush();
            return 1;
        }

        long failures = results.stream().filter(r -> !r.success()).count();
        if (json) {
            out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(results));
        } else {
            for (PolicyTestResult result : results) {
                if (result.success()) {
                    out.println("✅ " + result.name());
                } else {
                    err.println("❌ " + result.name() + ": " + result.error());
                }
            }
        }
        out.flush();
        err.flush();
        return failures == 0 ? 0 : 1;
    }
}
