package work.lcod.synth.select;

import work.lcod.synth.shared.SynthesisException;

/**
 * A placement query that must match something matched nothing.
 */
public final class EmptySelectionException extends SynthesisException {
    public EmptySelectionException(String message) {
        super("empty_selection", message);
    }
}
