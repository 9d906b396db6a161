package work.lcod.synth.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.synth.api.LogLevel;
import work.lcod.synth.api.SynthConfigLoader;
import work.lcod.synth.api.SynthConfiguration;
import work.lcod.synth.api.SynthRunner;
import work.lcod.synth.template.OutputFormat;

@CommandLine.Command(
    name = "lcod-synth",
    description = "Synthesize a construct model into one template per stack.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class SynthCommand implements Callable<Integer> {
    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-m", "--model"},
        required = true,
        description = "Model file (YAML or JSON)."
    )
    Path model;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Assembly output directory (default: [output] directory from the config, else cdk.out).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path output;

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Template format (json|yaml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String format;

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "TOML configuration (default: synth.toml next to the model, when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path config;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String logLevelRaw;

    @Override
    public Integer call() {
        var configuration = resolveConfiguration();
        System.setProperty(LOG_LEVEL_PROPERTY, configuration.logLevel().simpleLoggerName());

        var result = new SynthRunner().run(configuration);
        System.out.println(result.toPrettyJson());
        return result.status().exitCode();
    }

    SynthConfiguration resolveConfiguration() {
        if (!Files.isRegularFile(model)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Model file not found: " + model);
        }
        var builder = SynthConfiguration.builder().modelFile(model);
        SynthConfigLoader.apply(resolveConfigPath(), builder);
        if (output != null) {
            builder.outputDirectory(output);
        }
        if (format != null) {
            builder.format(OutputFormat.from(format));
        }
        if (logLevelRaw != null) {
            builder.logLevel(LogLevel.from(logLevelRaw));
        }
        return builder.build();
    }

    private Path resolveConfigPath() {
        if (config != null) {
            if (!Files.isRegularFile(config)) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Config file not found: " + config);
            }
            return config;
        }
        var parent = model.toAbsolutePath().getParent();
        return parent == null ? null : parent.resolve(SynthConfigLoader.DEFAULT_FILE_NAME);
    }
}
