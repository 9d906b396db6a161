package work.lcod.synth.resource;

import java.util.LinkedHashMap;
import work.lcod.synth.token.Token;
import work.lcod.synth.tree.Construct;

/**
 * Externally supplied template parameter. Referencing it yields {@code {"Ref": id}}.
 */
public class CfnParameter extends CfnElement {
    private final String type;
    private final Object defaultValue;
    private final String description;

    public CfnParameter(Construct scope, String id, String type) {
        this(scope, id, type, null, null);
    }

    public CfnParameter(Construct scope, String id, String type, Object defaultValue, String description) {
        super(scope, id);
        this.type = type == null || type.isBlank() ? "String" : type;
        this.defaultValue = defaultValue;
        this.description = description;
    }

    public Token value() {
        return reference(Token.REF_ATTRIBUTE);
    }

    @Override
    public TemplateSection section() {
        return TemplateSection.PARAMETERS;
    }

    @Override
    public Entity entity() {
        var props = new LinkedHashMap<String, Object>();
        if (defaultValue != null) {
            props.put("Default", defaultValue);
        }
        if (description != null) {
            props.put("Description", description);
        }
        return new Entity(type, props);
    }
}
