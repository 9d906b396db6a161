package work.lcod.synth.token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.lcod.synth.tree.Construct;
import work.lcod.synth.tree.Stack;

/**
 * Deep token resolution for one synthesis run. Values are walked depth-first; map entries that
 * resolve to nothing are dropped, list entries keep their index. Each token is computed at most
 * once per consuming stack and the result, together with the producers it referenced, is cached
 * so later hits replay the same dependency edges.
 */
public final class Resolver {
    private final ReferenceHandler references;
    private final Map<CacheKey, Resolution> cache = new HashMap<>();
    private final Deque<Frame> frames = new ArrayDeque<>();

    public Resolver(ReferenceHandler references) {
        this.references = Objects.requireNonNull(references, "references");
    }

    public Object resolve(Object value, Construct consumer) {
        return resolveValue(value, new Context(consumer));
    }

    public int cachedTokenCount() {
        return cache.size();
    }

    private Object resolveValue(Object value, Context ctx) {
        if (value instanceof Token token) {
            return resolveToken(token, ctx);
        }
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                var resolved = resolveValue(entry.getValue(), ctx);
                if (resolved != null) {
                    copy.put(String.valueOf(entry.getKey()), resolved);
                }
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            // entries keep their index, nulls included
            var copy = new ArrayList<>(list.size());
            for (var item : list) {
                copy.add(resolveValue(item, ctx));
            }
            return copy;
        }
        return value;
    }

    private Object resolveToken(Token token, Context ctx) {
        var key = new CacheKey(token, ctx.consumerStack());
        var cached = cache.get(key);
        if (cached != null) {
            for (Construct producer : cached.producers()) {
                references.recordEdge(ctx.consumer(), producer);
                noteProducer(producer);
            }
            return cached.value();
        }
        for (Frame frame : frames) {
            if (frame.token == token) {
                throw new CyclicTokenException(cycleChain(token));
            }
        }
        var frame = new Frame(token);
        frames.push(frame);
        Object resolved;
        try {
            resolved = resolveValue(token.compute(ctx), ctx);
            checkShape(token, resolved);
        } finally {
            frames.pop();
        }
        cache.put(key, new Resolution(resolved, List.copyOf(frame.producers)));
        frame.producers.forEach(this::noteProducer);
        return resolved;
    }

    private void noteProducer(Construct producer) {
        var current = frames.peek();
        if (current != null) {
            current.producers.add(producer);
        }
    }

    private List<String> cycleChain(Token repeated) {
        var chain = new ArrayList<String>();
        var outermostFirst = new ArrayList<>(frames);
        Collections.reverse(outermostFirst);
        boolean inCycle = false;
        for (Frame frame : outermostFirst) {
            if (frame.token == repeated) {
                inCycle = true;
            }
            if (inCycle) {
                chain.add(frame.token.displayHint());
            }
        }
        chain.add(repeated.displayHint());
        return chain;
    }

    private static void checkShape(Token token, Object resolved) {
        if (resolved == null || Fn.isIntrinsic(resolved)) {
            return;
        }
        boolean matches = switch (token.shape()) {
            case STRING -> resolved instanceof String;
            case NUMBER -> resolved instanceof Number;
            case LIST -> resolved instanceof List<?>;
            case MAP -> resolved instanceof Map<?, ?>;
            case ANY -> true;
        };
        if (!matches) {
            throw new IllegalStateException(
                "Token " + token.displayHint() + " declared as " + token.shape()
                    + " resolved to " + resolved.getClass().getSimpleName()
            );
        }
    }

    private final class Context implements ResolveContext {
        private final Construct consumer;
        private final Stack consumerStack;

        private Context(Construct consumer) {
            this.consumer = Objects.requireNonNull(consumer, "consumer");
            this.consumerStack = consumer.stack();
        }

        @Override
        public Construct consumer() {
            return consumer;
        }

        @Override
        public Stack consumerStack() {
            return consumerStack;
        }

        @Override
        public Object reference(Construct producer, String attribute) {
            noteProducer(producer);
            return references.reference(consumer, producer, attribute);
        }

        @Override
        public Object resolve(Object value) {
            return resolveValue(value, this);
        }
    }

    private static final class Frame {
        private final Token token;
        private final Set<Construct> producers = new LinkedHashSet<>();

        private Frame(Token token) {
            this.token = token;
        }
    }

    private record CacheKey(Token token, Stack stack) {}

    private record Resolution(Object value, List<Construct> producers) {}
}
