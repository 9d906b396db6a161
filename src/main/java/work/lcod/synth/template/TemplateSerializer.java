package work.lcod.synth.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

/**
 * Stable text rendering of templates and manifests.
 */
public final class TemplateSerializer {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();
    private static final ObjectWriter YAML_WRITER = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
    ).writer();

    private TemplateSerializer() {}

    public static String toJson(Object document) {
        return write(JSON_WRITER, document);
    }

    public static String toYaml(Object document) {
        return write(YAML_WRITER, document);
    }

    public static String serialize(Object document, OutputFormat format) {
        return format == OutputFormat.YAML ? toYaml(document) : toJson(document);
    }

    private static String write(ObjectWriter writer, Object document) {
        try {
            return writer.writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize template: " + ex.getOriginalMessage(), ex);
        }
    }
}
