package work.lcod.synth.tree;

import java.util.Collection;

/**
 * Something other constructs can take an ordering dependency on.
 */
@FunctionalInterface
public interface Dependable {
    /**
     * Constructs that must be deployed before a dependent. Each element expands to every
     * emitted resource found in its subtree.
     */
    Collection<? extends Construct> dependencyElements();
}
