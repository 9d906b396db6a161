package work.lcod.synth.api;

import java.nio.file.Path;
import java.util.Objects;
import work.lcod.synth.select.SelectionPolicy;
import work.lcod.synth.template.OutputFormat;

/**
 * Immutable configuration of one synthesis run. {@code modelFile} may be {@code null} when the
 * app is built in code.
 */
public record SynthConfiguration(
    Path modelFile,
    Path outputDirectory,
    OutputFormat format,
    LogLevel logLevel,
    SelectionPolicy selectionPolicy
) {
    public static final Path DEFAULT_OUTPUT_DIRECTORY = Path.of("cdk.out");

    public SynthConfiguration {
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(selectionPolicy, "selectionPolicy");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path modelFile;
        private Path outputDirectory = DEFAULT_OUTPUT_DIRECTORY;
        private OutputFormat format = OutputFormat.JSON;
        private LogLevel logLevel = LogLevel.WARN;
        private SelectionPolicy selectionPolicy = SelectionPolicy.defaults();

        public Builder modelFile(Path modelFile) {
            this.modelFile = modelFile;
            return this;
        }

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder format(OutputFormat format) {
            this.format = format;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder selectionPolicy(SelectionPolicy selectionPolicy) {
            this.selectionPolicy = selectionPolicy;
            return this;
        }

        public SynthConfiguration build() {
            return new SynthConfiguration(modelFile, outputDirectory, format, logLevel, selectionPolicy);
        }
    }
}
