package work.lcod.synth.template;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.synth.tree.Environment;

/**
 * Synthesized output of one stack: its template plus the stacks it must be deployed after.
 */
public record StackArtifact(
    String stackName,
    String constructPath,
    Environment environment,
    List<String> dependencies,
    Map<String, Object> template
) {
    public StackArtifact {
        Objects.requireNonNull(stackName, "stackName");
        dependencies = List.copyOf(dependencies);
        template = Collections.unmodifiableMap(template);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> section(String key) {
        var section = template.get(key);
        return section instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    public Map<String, Object> resources() {
        return section("Resources");
    }

    public Map<String, Object> outputs() {
        return section("Outputs");
    }

    public Map<String, Object> parameters() {
        return section("Parameters");
    }
}
