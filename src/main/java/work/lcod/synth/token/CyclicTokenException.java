package work.lcod.synth.token;

import java.util.List;
import work.lcod.synth.shared.SynthesisException;

/**
 * A token depends on itself, directly or through other tokens.
 */
public final class CyclicTokenException extends SynthesisException {
    private final List<String> chain;

    public CyclicTokenException(List<String> chain) {
        super("cyclic_token", "Token resolution cycle: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    public List<String> chain() {
        return chain;
    }
}
