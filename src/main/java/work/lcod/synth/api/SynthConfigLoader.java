package work.lcod.synth.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.lcod.synth.select.SelectionPolicy;
import work.lcod.synth.template.OutputFormat;

/**
 * Applies a {@code synth.toml} file on top of a configuration builder.
 *
 * <pre>
 * [output]
 * directory = "cdk.out"   # relative to the TOML file
 * format = "json"
 *
 * [log]
 * level = "info"
 *
 * [selection]
 * default_category = "Private"
 * </pre>
 */
public final class SynthConfigLoader {
    public static final String DEFAULT_FILE_NAME = "synth.toml";

    private SynthConfigLoader() {}

    public static SynthConfiguration.Builder apply(Path tomlFile, SynthConfiguration.Builder builder) {
        if (tomlFile == null || !Files.isRegularFile(tomlFile)) {
            return builder;
        }
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(tomlFile));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read configuration: " + tomlFile, ex);
        }
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid configuration " + tomlFile + ": " + errors);
        }
        return fromToml(result, tomlFile.toAbsolutePath().getParent(), builder);
    }

    static SynthConfiguration.Builder fromToml(TomlParseResult result, Path baseDirectory, SynthConfiguration.Builder builder) {
        var directory = result.getString("output.directory");
        if (directory != null && !directory.isBlank()) {
            var path = Path.of(directory);
            builder.outputDirectory(path.isAbsolute() || baseDirectory == null ? path : baseDirectory.resolve(path));
        }
        var format = result.getString("output.format");
        if (format != null) {
            builder.format(OutputFormat.from(format));
        }
        var level = result.getString("log.level");
        if (level != null) {
            builder.logLevel(LogLevel.from(level));
        }
        var category = result.getString("selection.default_category");
        if (category != null && !category.isBlank()) {
            builder.selectionPolicy(new SelectionPolicy(category));
        }
        return builder;
    }
}
