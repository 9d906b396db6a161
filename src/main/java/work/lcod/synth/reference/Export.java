package work.lcod.synth.reference;

/**
 * Generated output of a producer stack that makes a value importable by name.
 */
public record Export(String outputKey, String exportName, Object value, Reference reference) {}
