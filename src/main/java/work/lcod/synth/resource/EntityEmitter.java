package work.lcod.synth.resource;

import java.util.Optional;
import work.lcod.synth.tree.Addressable;

/**
 * Capability of contributing an entity to the enclosing stack's template.
 */
public interface EntityEmitter extends Addressable {
    TemplateSection section();

    Entity entity();

    /**
     * Fixed logical id, when the author pinned one.
     */
    default Optional<String> logicalIdOverride() {
        return Optional.empty();
    }
}
