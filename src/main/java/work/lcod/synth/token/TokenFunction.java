package work.lcod.synth.token;

/**
 * Computes the value behind a token. The result may itself contain tokens.
 */
@FunctionalInterface
public interface TokenFunction {
    Object compute(ResolveContext ctx);
}
