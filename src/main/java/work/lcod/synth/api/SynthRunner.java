package work.lcod.synth.api;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.synth.model.ModelLoader;
import work.lcod.synth.shared.SynthesisException;
import work.lcod.synth.template.AssemblyWriter;
import work.lcod.synth.template.Synthesizer;
import work.lcod.synth.tree.App;

/**
 * Public entry point for embedding the synthesizer: load a model, synthesize it and write the
 * assembly.
 */
public final class SynthRunner {
    private static final Logger LOG = LoggerFactory.getLogger(SynthRunner.class);

    public SynthResult run(SynthConfiguration configuration) {
        var started = Instant.now();
        try {
            if (configuration.modelFile() == null) {
                throw new IllegalArgumentException("No model file configured");
            }
            var app = ModelLoader.loadFromLocalFile(configuration.modelFile(), configuration.selectionPolicy());
            return synthesizeAndWrite(app, configuration, started);
        } catch (SynthesisException ex) {
            LOG.debug("Synthesis failed", ex);
            return SynthResult.failure(ex.getMessage(), ex.code(), errorMeta(configuration), started);
        } catch (Exception ex) {
            LOG.debug("Synthesis failed", ex);
            return SynthResult.failure(ex.getMessage(), null, errorMeta(configuration), started);
        }
    }

    /**
     * Synthesizes an app built in code, writing the assembly where the configuration says.
     */
    public SynthResult run(App app, SynthConfiguration configuration) {
        var started = Instant.now();
        try {
            return synthesizeAndWrite(app, configuration, started);
        } catch (SynthesisException ex) {
            LOG.debug("Synthesis failed", ex);
            return SynthResult.failure(ex.getMessage(), ex.code(), errorMeta(configuration), started);
        } catch (Exception ex) {
            LOG.debug("Synthesis failed", ex);
            return SynthResult.failure(ex.getMessage(), null, errorMeta(configuration), started);
        }
    }

    private SynthResult synthesizeAndWrite(App app, SynthConfiguration configuration, Instant started) throws Exception {
        var assembly = new Synthesizer().synthesize(app);
        var files = new AssemblyWriter(configuration.format()).write(assembly, configuration.outputDirectory());

        var metadata = new LinkedHashMap<String, Object>();
        if (configuration.modelFile() != null) {
            metadata.put("model", configuration.modelFile().toString());
        }
        metadata.put("app", app.id());
        metadata.put("outputDirectory", configuration.outputDirectory().toString());
        metadata.put("format", configuration.format().extension());
        metadata.put("stacks", assembly.stacks().stream().map(artifact -> artifact.stackName()).collect(Collectors.toList()));
        metadata.put("files", files.stream().map(path -> path.getFileName().toString()).collect(Collectors.toList()));
        return SynthResult.success(assembly, metadata, started);
    }

    private static LinkedHashMap<String, Object> errorMeta(SynthConfiguration configuration) {
        var meta = new LinkedHashMap<String, Object>();
        if (configuration.modelFile() != null) {
            meta.put("model", configuration.modelFile().toString());
        }
        return meta;
    }
}
