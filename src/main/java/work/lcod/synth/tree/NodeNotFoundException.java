package work.lcod.synth.tree;

import work.lcod.synth.shared.SynthesisException;

/**
 * A required ancestor, child or path could not be located.
 */
public final class NodeNotFoundException extends SynthesisException {
    public NodeNotFoundException(String message) {
        super("not_found", message);
    }
}
