package work.lcod.synth.select;

import work.lcod.synth.shared.SynthesisException;

/**
 * A placement query is over-constrained.
 */
public final class AmbiguousSelectionException extends SynthesisException {
    public AmbiguousSelectionException(String message) {
        super("ambiguous_selection", message);
    }
}
