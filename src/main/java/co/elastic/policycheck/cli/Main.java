package co.elastic.policycheck.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new PolicyCheckCommand())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExecutionStrategy(PolicyCheckCommand::execute)
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
