package work.lcod.synth.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.synth.template.OutputFormat;

class SynthConfigLoaderTest {
    private static final Path CONFIG = Path.of("src", "test", "resources", "config", "synth.toml");

    @TempDir
    Path tempDir;

    @Test
    void appliesTomlSettings() {
        var builder = SynthConfiguration.builder().modelFile(Path.of("model.yaml"));
        var config = SynthConfigLoader.apply(CONFIG, builder).build();

        assertEquals(CONFIG.toAbsolutePath().getParent().resolve("build/templates"), config.outputDirectory());
        assertEquals(OutputFormat.YAML, config.format());
        assertEquals(LogLevel.DEBUG, config.logLevel());
        assertEquals("Isolated", config.selectionPolicy().defaultCategory());
    }

    @Test
    void missingFileKeepsDefaults() {
        var builder = SynthConfiguration.builder().modelFile(Path.of("model.yaml"));
        assertSame(builder, SynthConfigLoader.apply(tempDir.resolve("absent.toml"), builder));

        var config = builder.build();
        assertEquals(SynthConfiguration.DEFAULT_OUTPUT_DIRECTORY, config.outputDirectory());
        assertEquals(OutputFormat.JSON, config.format());
        assertEquals(LogLevel.WARN, config.logLevel());
        assertEquals("Private", config.selectionPolicy().defaultCategory());
    }

    @Test
    void absoluteDirectoriesAreKept() throws Exception {
        var toml = tempDir.resolve("synth.toml");
        var target = tempDir.resolve("elsewhere").toAbsolutePath();
        Files.writeString(toml, "[output]\ndirectory = \"" + target.toString().replace("\\", "\\\\") + "\"\n");

        var config = SynthConfigLoader.apply(toml, SynthConfiguration.builder()).build();
        assertEquals(target, config.outputDirectory());
    }

    @Test
    void rejectsMalformedToml() throws Exception {
        var toml = tempDir.resolve("synth.toml");
        Files.writeString(toml, "[output\nformat = ");

        assertThrows(IllegalArgumentException.class, () -> SynthConfigLoader.apply(toml, SynthConfiguration.builder()));
    }

    @Test
    void rejectsUnknownValues() throws Exception {
        var toml = tempDir.resolve("synth.toml");
        Files.writeString(toml, "[output]\nformat = \"xml\"\n");

        assertThrows(IllegalArgumentException.class, () -> SynthConfigLoader.apply(toml, SynthConfiguration.builder()));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("loud"));
    }
}
