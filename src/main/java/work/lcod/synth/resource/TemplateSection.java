package work.lcod.synth.resource;

/**
 * Top-level template sections, in output order.
 */
public enum TemplateSection {
    METADATA("Metadata"),
    PARAMETERS("Parameters"),
    RESOURCES("Resources"),
    OUTPUTS("Outputs");

    private final String key;

    TemplateSection(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
