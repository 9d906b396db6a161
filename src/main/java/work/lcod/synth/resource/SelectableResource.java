package work.lcod.synth.resource;

import java.util.Map;
import java.util.Objects;
import work.lcod.synth.select.Selectable;
import work.lcod.synth.tree.Construct;

/**
 * A resource tagged with a placement category and group name (a subnet, for instance), so
 * placement queries can pick it.
 */
public class SelectableResource extends CfnResource implements Selectable {
    private final String category;
    private final String groupName;

    public SelectableResource(Construct scope, String id, String type, String category, String groupName) {
        this(scope, id, type, category, groupName, Map.of());
    }

    public SelectableResource(
        Construct scope,
        String id,
        String type,
        String category,
        String groupName,
        Map<String, ?> properties
    ) {
        super(scope, id, type, properties);
        this.category = Objects.requireNonNull(category, "category");
        this.groupName = groupName == null ? id : groupName;
    }

    @Override
    public String category() {
        return category;
    }

    @Override
    public String groupName() {
        return groupName;
    }
}
