package work.lcod.synth.reference;

import work.lcod.synth.shared.SynthesisException;

/**
 * A reference crosses stacks that cannot be linked by an export/import pair.
 */
public final class UnresolvableReferenceException extends SynthesisException {
    public UnresolvableReferenceException(String message) {
        super("unresolvable_reference", message);
    }
}
