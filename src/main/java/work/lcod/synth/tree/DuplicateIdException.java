package work.lcod.synth.tree;

import work.lcod.synth.shared.SynthesisException;

/**
 * Two siblings registered the same id.
 */
public final class DuplicateIdException extends SynthesisException {
    private final String scopePath;
    private final String duplicateId;

    public DuplicateIdException(String scopePath, String duplicateId) {
        super("duplicate_id", "There is already a construct with id '" + duplicateId + "' in " + describe(scopePath));
        this.scopePath = scopePath;
        this.duplicateId = duplicateId;
    }

    public String scopePath() {
        return scopePath;
    }

    public String duplicateId() {
        return duplicateId;
    }

    private static String describe(String scopePath) {
        return scopePath == null || scopePath.isEmpty() ? "the root" : "'" + scopePath + "'";
    }
}
