package work.lcod.synth.template;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a {@link CloudAssembly} to a directory: {@code <stack>.template.<ext>} per stack plus
 * {@code manifest.json}.
 */
public final class AssemblyWriter {
    public static final String MANIFEST_FILE = "manifest.json";

    private static final Logger LOG = LoggerFactory.getLogger(AssemblyWriter.class);

    private final OutputFormat format;

    public AssemblyWriter(OutputFormat format) {
        this.format = format == null ? OutputFormat.JSON : format;
    }

    public static String templateFileName(String stackName, OutputFormat format) {
        return stackName + ".template." + format.extension();
    }

    /**
     * @return written files, templates first and the manifest last
     */
    public List<Path> write(CloudAssembly assembly, Path directory) throws IOException {
        Files.createDirectories(directory);
        var written = new ArrayList<Path>();
        for (StackArtifact artifact : assembly.stacks()) {
            var file = directory.resolve(templateFileName(artifact.stackName(), format));
            Files.writeString(file, TemplateSerializer.serialize(artifact.template(), format), StandardCharsets.UTF_8);
            written.add(file);
            LOG.debug("Wrote {}", file);
        }
        var manifest = directory.resolve(MANIFEST_FILE);
        Files.writeString(manifest, TemplateSerializer.toJson(assembly.manifest()), StandardCharsets.UTF_8);
        written.add(manifest);
        return written;
    }
}
