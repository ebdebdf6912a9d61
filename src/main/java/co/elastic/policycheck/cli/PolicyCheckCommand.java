package co.elastic.policycheck.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "policy-check",
    description = "Canonicalize Fleet agent policies and compare them with expected fixtures.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true,
    subcommands = {
        CanonicalizeCommand.class,
        CompareCommand.class,
        PolicyTestCommand.class
    }
)
final class PolicyCheckCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (${COMPLETION-CANDIDATES}).",
        defaultValue = "WARN"
    )
    private LogLevel logLevel = LogLevel.WARN;

    /**
     * Applies the global options before running the selected subcommand.
     */
    static int execute(CommandLine.ParseResult parseResult) {
        PolicyCheckCommand root = parseResult.commandSpec().commandLine().getCommand();
        root.logLevel.apply();
        return new CommandLine.RunLast().execute(parseResult);
    }

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand.");
    }
}
