package work.lcod.synth.id;

import work.lcod.synth.shared.SynthesisException;

/**
 * Two distinct paths were assigned the same identifier.
 */
public final class AllocationException extends SynthesisException {
    public AllocationException(String message) {
        super("allocation_collision", message);
    }
}
