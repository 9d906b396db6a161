package work.lcod.synth.select;

/**
 * Whether a category query may match nothing.
 */
public enum QueryMode {
    REQUIRED,
    ALLOW_NONE
}
