package work.lcod.synth.resource;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import work.lcod.synth.token.Token;
import work.lcod.synth.tree.Construct;

/**
 * Base for constructs that emit exactly one template entity.
 */
public abstract class CfnElement extends Construct implements EntityEmitter {
    private final Map<String, Token> attributeTokens = new HashMap<>();
    private String logicalIdOverride;

    protected CfnElement(Construct scope, String id) {
        super(scope, id);
    }

    /**
     * Pins the logical id instead of deriving it from the path.
     */
    public void overrideLogicalId(String logicalId) {
        ensureUnlocked();
        if (logicalId == null || !logicalId.matches("[A-Za-z0-9]+")) {
            throw new IllegalArgumentException("Logical id override must be alphanumeric: " + logicalId);
        }
        this.logicalIdOverride = logicalId;
    }

    @Override
    public Optional<String> logicalIdOverride() {
        return Optional.ofNullable(logicalIdOverride);
    }

    /**
     * Token for {@code attribute}; repeated requests return the same instance.
     */
    public Token reference(String attribute) {
        return attributeTokens.computeIfAbsent(attribute, name -> Token.reference(this, name));
    }
}
