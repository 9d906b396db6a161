package work.lcod.synth.template;

import java.util.HashMap;
import java.util.Map;
import work.lcod.synth.graph.DependencyGraph;
import work.lcod.synth.id.LogicalIdAllocator;
import work.lcod.synth.reference.CrossStackReferences;
import work.lcod.synth.resource.EntityEmitter;
import work.lcod.synth.token.ReferenceHandler;
import work.lcod.synth.token.Resolver;
import work.lcod.synth.tree.Construct;
import work.lcod.synth.tree.Stack;

/**
 * All mutable state of one synthesis run. The construct tree itself is only read.
 */
final class SynthesisSession implements ReferenceHandler {
    private final Map<Stack, LogicalIdAllocator> allocators = new HashMap<>();
    private final DependencyGraph<Construct> constructGraph = new DependencyGraph<>(Construct::pathString);
    private final DependencyGraph<Stack> stackGraph = new DependencyGraph<>(Stack::stackName);
    private final CrossStackReferences references = new CrossStackReferences(this::allocator, stackGraph);
    private final Resolver resolver = new Resolver(this);

    LogicalIdAllocator allocator(Stack stack) {
        return allocators.computeIfAbsent(stack, key -> new LogicalIdAllocator(key, SynthesisSession::overrideOf));
    }

    DependencyGraph<Construct> constructGraph() {
        return constructGraph;
    }

    DependencyGraph<Stack> stackGraph() {
        return stackGraph;
    }

    CrossStackReferences references() {
        return references;
    }

    Resolver resolver() {
        return resolver;
    }

    @Override
    public Object reference(Construct consumer, Construct producer, String attribute) {
        var rendered = references.resolve(consumer, producer, attribute);
        constructGraph.addDependency(consumer, producer);
        return rendered;
    }

    @Override
    public void recordEdge(Construct consumer, Construct producer) {
        constructGraph.addDependency(consumer, producer);
        var consumerStack = consumer.stack();
        var producerStack = producer.stack();
        if (consumerStack != producerStack) {
            stackGraph.addDependency(consumerStack, producerStack);
        }
    }

    private static String overrideOf(Construct construct) {
        if (construct instanceof EntityEmitter emitter) {
            return emitter.logicalIdOverride().orElse(null);
        }
        return null;
    }
}
