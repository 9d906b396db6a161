package work.lcod.synth.token;

/**
 * Intended shape of a token's resolved value.
 */
public enum TokenShape {
    STRING,
    NUMBER,
    LIST,
    MAP,
    ANY
}
