package work.lcod.synth.graph;

import java.util.List;
import work.lcod.synth.shared.SynthesisException;

/**
 * The dependency graph contains a cycle. {@link #cycle()} lists it with the first node repeated
 * at the end.
 */
public final class CyclicDependencyException extends SynthesisException {
    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super("cyclic_dependency", "Dependency cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
