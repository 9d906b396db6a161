package work.lcod.synth.token;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import work.lcod.synth.tree.Construct;

/**
 * Placeholder for a value that is only known at synthesis time. Tokens compare by identity;
 * the resolver caches their value per consuming stack.
 */
public final class Token {
    public static final String REF_ATTRIBUTE = "Ref";

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final Construct producer;
    private final TokenShape shape;
    private final TokenFunction function;
    private final String displayHint;

    private Token(Construct producer, TokenShape shape, TokenFunction function, String displayHint) {
        this.producer = producer;
        this.shape = Objects.requireNonNull(shape, "shape");
        this.function = Objects.requireNonNull(function, "function");
        this.displayHint = displayHint == null || displayHint.isBlank()
            ? "Token" + SEQUENCE.incrementAndGet()
            : displayHint;
    }

    public static Token lazy(TokenShape shape, TokenFunction function) {
        return new Token(null, shape, function, null);
    }

    public static Token lazy(String displayHint, TokenShape shape, TokenFunction function) {
        return new Token(null, shape, function, displayHint);
    }

    public static Token of(Construct producer, String displayHint, TokenShape shape, TokenFunction function) {
        return new Token(Objects.requireNonNull(producer, "producer"), shape, function, displayHint);
    }

    /**
     * Token standing for {@code attribute} of {@code producer}; {@link #REF_ATTRIBUTE} is the
     * producer's primary reference.
     */
    public static Token reference(Construct producer, String attribute) {
        Objects.requireNonNull(attribute, "attribute");
        return of(
            producer,
            producer.pathString() + "." + attribute,
            TokenShape.STRING,
            ctx -> ctx.reference(producer, attribute)
        );
    }

    public Optional<Construct> producer() {
        return Optional.ofNullable(producer);
    }

    public TokenShape shape() {
        return shape;
    }

    public String displayHint() {
        return displayHint;
    }

    Object compute(ResolveContext ctx) {
        return function.compute(ctx);
    }

    @Override
    public String toString() {
        return "${Token[" + displayHint + "]}";
    }
}
