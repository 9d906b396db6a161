package work.lcod.synth.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.synth.support.SynthTestSupport.bucket;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.synth.tree.App;
import work.lcod.synth.tree.Stack;

class AssemblyWriterTest {
    @TempDir
    Path tempDir;

    @Test
    void writesOneTemplatePerStackAndTheManifest() throws Exception {
        var app = new App();
        bucket(new Stack(app, "Storage"), "Bucket");
        new Stack(app, "Empty");
        var assembly = new Synthesizer().synthesize(app);

        var files = new AssemblyWriter(OutputFormat.JSON).write(assembly, tempDir.resolve("out"));

        assertEquals(
            List.of("Storage.template.json", "Empty.template.json", AssemblyWriter.MANIFEST_FILE),
            files.stream().map(path -> path.getFileName().toString()).toList()
        );
        var template = new ObjectMapper().readTree(files.get(0).toFile());
        assertEquals(1, template.get("Resources").size());
        var manifest = new ObjectMapper().readTree(files.get(2).toFile());
        assertTrue(manifest.get("artifacts").has("Storage"));
    }

    @Test
    void writesYamlTemplates() throws Exception {
        var app = new App();
        bucket(new Stack(app, "Storage"), "Bucket");
        var assembly = new Synthesizer().synthesize(app);

        var files = new AssemblyWriter(OutputFormat.YAML).write(assembly, tempDir);

        var yaml = Files.readString(tempDir.resolve("Storage.template.yaml"));
        assertTrue(yaml.startsWith("Resources:"));
        assertTrue(yaml.contains("Type: \"AWS::S3::Bucket\"") || yaml.contains("Type: AWS::S3::Bucket"));
        assertEquals(2, files.size());
    }

    @Test
    void parsesOutputFormats() {
        assertEquals(OutputFormat.YAML, OutputFormat.from("yml"));
        assertEquals(OutputFormat.YAML, OutputFormat.from(" YAML "));
        assertEquals(OutputFormat.JSON, OutputFormat.from(null));
        assertEquals("Web.template.yaml", AssemblyWriter.templateFileName("Web", OutputFormat.YAML));
    }
}
