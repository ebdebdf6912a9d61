package co.elastic.policycheck.cli;

import co.elastic.policycheck.api.PolicyCanonicalizer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "canonicalize",
    description = "Print the canonical form of a policy, as stored in expected fixtures.",
    mixinStandardHelpOptions = true
)
final class CanonicalizeCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "POLICY|-", description = "Policy file; use '-' to read from stdin.")
    private String policy;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write the canonical policy to this file instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path output;

    @Override
    public Integer call() throws IOException {
        byte[] canonical = new PolicyCanonicalizer().canonicalize(PolicyFiles.read(policy));
        if (output != null) {
            Files.write(output, canonical);
        } else {
            spec.commandLine().getOut().print(new String(canonical, StandardCharsets.UTF_8));
            spec.commandLine().getOut().flush();
        }
        return 0;
    }
}
