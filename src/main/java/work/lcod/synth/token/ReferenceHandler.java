package work.lcod.synth.token;

import work.lcod.synth.tree.Construct;

/**
 * Bridge from the resolver to whoever owns logical ids, exports and the dependency graph.
 */
public interface ReferenceHandler {
    Object reference(Construct consumer, Construct producer, String attribute);

    /**
     * Replays the edge implied by a reference whose resolution came from the cache.
     */
    void recordEdge(Construct consumer, Construct producer);
}
