package work.lcod.synth.reference;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import work.lcod.synth.tree.Stack;

/**
 * Exports of a single producer stack, deduplicated by producer path and attribute.
 */
public final class ExportRegistry {
    private final Stack stack;
    private final Map<ExportKey, Export> exports = new LinkedHashMap<>();

    public ExportRegistry(Stack stack) {
        this.stack = stack;
    }

    public Stack stack() {
        return stack;
    }

    /**
     * Returns the existing export for the same producer path and attribute, or registers the
     * one built by {@code factory}.
     */
    public Export register(String producerPath, String attribute, Supplier<Export> factory) {
        var key = new ExportKey(producerPath, attribute);
        var existing = exports.get(key);
        if (existing != null) {
            return existing;
        }
        var export = factory.get();
        exports.put(key, export);
        return export;
    }

    public boolean hasOutputKey(String outputKey) {
        for (var export : exports.values()) {
            if (export.outputKey().equals(outputKey)) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return exports.isEmpty();
    }

    /**
     * Exports ordered by output key so the template does not depend on discovery order.
     */
    public List<Export> exports() {
        var sorted = new ArrayList<>(exports.values());
        sorted.sort(Comparator.comparing(Export::outputKey));
        return sorted;
    }

    private record ExportKey(String producerPath, String attribute) {}
}
