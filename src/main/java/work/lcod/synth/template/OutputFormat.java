package work.lcod.synth.template;

import java.util.Locale;

/**
 * Serialization format of written templates.
 */
public enum OutputFormat {
    JSON("json"),
    YAML("yaml");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static OutputFormat from(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        var normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("YML".equals(normalized)) {
            return YAML;
        }
        try {
            return OutputFormat.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported output format: " + value);
        }
    }
}
