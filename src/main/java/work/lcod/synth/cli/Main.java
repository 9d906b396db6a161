package work.lcod.synth.cli;

import picocli.CommandLine;

/**
 * {@code lcod-synth} launcher. Exit codes: 0 on success, 1 when synthesis fails, 2 on usage errors.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /**
     * The configured {@code synth} command, shared by the launcher and embedders that want to
     * redirect its output streams.
     */
    public static CommandLine commandLine() {
        return new CommandLine(new SynthCommand())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
