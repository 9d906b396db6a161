package work.lcod.synth.token;

import work.lcod.synth.tree.Construct;
import work.lcod.synth.tree.Stack;

/**
 * What a token function can see while it is being resolved.
 */
public interface ResolveContext {
    /**
     * Construct whose emitted entity is being resolved.
     */
    Construct consumer();

    Stack consumerStack();

    /**
     * Renders {@code attribute} of {@code producer} as seen from the consumer and records the
     * implied dependency.
     */
    Object reference(Construct producer, String attribute);

    /**
     * Resolves a nested value (tokens, lists, maps) in this same context.
     */
    Object resolve(Object value);
}
