package work.lcod.synth.template;

import java.util.List;
import java.util.Map;
import work.lcod.synth.resource.EntityEmitter;

/**
 * An entity after token resolution, keyed by its allocated logical id.
 */
record ResolvedEntity(
    EntityEmitter emitter,
    String logicalId,
    String type,
    Map<String, Object> properties,
    List<String> dependsOn
) {}
