package work.lcod.synth.resource;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.synth.tree.Construct;

/**
 * Author-declared stack output, optionally exported under a fixed name.
 */
public class CfnOutput extends CfnElement {
    public static final String TYPE = "Output";

    private final Object value;
    private final String description;
    private final String exportName;

    public CfnOutput(Construct scope, String id, Object value) {
        this(scope, id, value, null, null);
    }

    public CfnOutput(Construct scope, String id, Object value, String description, String exportName) {
        super(scope, id);
        this.value = Objects.requireNonNull(value, "value");
        this.description = description;
        this.exportName = exportName;
    }

    public Object value() {
        return value;
    }

    public String exportName() {
        return exportName;
    }

    @Override
    public TemplateSection section() {
        return TemplateSection.OUTPUTS;
    }

    @Override
    public Entity entity() {
        var props = new LinkedHashMap<String, Object>();
        if (description != null) {
            props.put("Description", description);
        }
        props.put("Value", value);
        if (exportName != null) {
            props.put("Export", Map.of("Name", exportName));
        }
        return new Entity(TYPE, props);
    }
}
