package work.lcod.synth.resource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unresolved document fragment contributed by a construct. Property values may hold tokens.
 */
public record Entity(String type, Map<String, Object> properties) {
    public Entity {
        Objects.requireNonNull(type, "type");
        properties = properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }
}
