package work.lcod.synth.resource;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.synth.token.Token;
import work.lcod.synth.tree.Construct;

/**
 * A typed resource record in the {@code Resources} section.
 */
public class CfnResource extends CfnElement {
    private final String type;
    private final Map<String, Object> properties = new LinkedHashMap<>();

    public CfnResource(Construct scope, String id, String type) {
        this(scope, id, type, Map.of());
    }

    public CfnResource(Construct scope, String id, String type, Map<String, ?> properties) {
        super(scope, id);
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Resource type is required for '" + pathString() + "'");
        }
        this.type = type;
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    public String type() {
        return type;
    }

    public CfnResource setProperty(String name, Object value) {
        ensureUnlocked();
        properties.put(Objects.requireNonNull(name, "name"), value);
        return this;
    }

    public Object property(String name) {
        return properties.get(name);
    }

    /**
     * The resource's primary reference ({@code Ref}).
     */
    public Token ref() {
        return reference(Token.REF_ATTRIBUTE);
    }

    public Token getAtt(String attribute) {
        return reference(attribute);
    }

    @Override
    public TemplateSection section() {
        return TemplateSection.RESOURCES;
    }

    @Override
    public Entity entity() {
        return new Entity(type, properties);
    }
}
