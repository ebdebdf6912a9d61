package co.elastic.policycheck.cli;

import co.elastic.policycheck.api.PolicyCheckConfiguration;
import co.elastic.policycheck.api.PolicyComparator;
import java.io.IOException;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "compare",
    description = "Compare an expected policy with a found one; exits with 1 when they differ.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class CompareCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "EXPECTED", description = "Expected policy or fixture.")
    private String expected;

    @CommandLine.Parameters(index = "1", paramLabel = "FOUND", description = "Policy as downloaded from Fleet; '-' reads stdin.")
    private String found;

    @CommandLine.Option(names = "--context", description = "Lines of context around each change.", defaultValue = "1")
    private int contextLines;

    @Override
    public Integer call() throws IOException {
        var configuration = PolicyCheckConfiguration.builder()
            .contextLines(contextLines)
            .build();
        String diff = new PolicyComparator(configuration).compare(PolicyFiles.read(expected), PolicyFiles.read(found));
        var out = spec.commandLine().getOut();
        if (diff.isEmpty()) {
            out.println("Policies match.");
            out.flush();
            return 0;
        }
        out.print(diff);
        out.flush();
        return 1;
    }
}
