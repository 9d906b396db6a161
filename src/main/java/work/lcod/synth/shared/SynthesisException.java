package work.lcod.synth.shared;

/**
 * Base of every error raised by the synthesis engine. {@link #code()} is stable across releases.
 */
public class SynthesisException extends RuntimeException {
    private final String code;

    public SynthesisException(String code, String message) {
        super(message);
        this.code = code;
    }

    public SynthesisException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
