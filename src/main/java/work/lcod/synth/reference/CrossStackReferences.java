package work.lcod.synth.reference;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.synth.graph.DependencyGraph;
import work.lcod.synth.id.LogicalIdAllocator;
import work.lcod.synth.id.LogicalIds;
import work.lcod.synth.resource.EntityEmitter;
import work.lcod.synth.resource.TemplateSection;
import work.lcod.synth.token.Fn;
import work.lcod.synth.token.Token;
import work.lcod.synth.tree.App;
import work.lcod.synth.tree.Construct;
import work.lcod.synth.tree.Stack;

/**
 * Renders references between constructs. Inside one stack a reference is a {@code Ref} or
 * {@code Fn::GetAtt}; across stacks it becomes an export on the producer plus an
 * {@code Fn::ImportValue} in the consumer, and the consumer stack is made to depend on the
 * producer stack.
 */
public final class CrossStackReferences {
    private static final Logger LOG = LoggerFactory.getLogger(CrossStackReferences.class);
    private static final String EXPORT_PREFIX = "ExportsOutput";

    private final Function<Stack, LogicalIdAllocator> allocators;
    private final DependencyGraph<Stack> stackGraph;
    private final Map<Stack, ExportRegistry> registries = new HashMap<>();

    public CrossStackReferences(Function<Stack, LogicalIdAllocator> allocators, DependencyGraph<Stack> stackGraph) {
        this.allocators = Objects.requireNonNull(allocators, "allocators");
        this.stackGraph = Objects.requireNonNull(stackGraph, "stackGraph");
    }

    public Object resolve(Construct consumer, Construct producer, String attribute) {
        var producerStack = producer.stack();
        var consumerStack = consumer.stack();
        if (producerStack == consumerStack) {
            return localExpression(producer, attribute);
        }
        ensureLinkable(producerStack, consumerStack, producer);
        var local = localExpression(producer, attribute);
        var reference = new Reference(producer, attribute, producerStack, consumerStack, local);
        var registry = exportsOf(producerStack);
        var export = registry.register(
            producer.pathString(),
            attribute,
            () -> newExport(reference, registry)
        );
        stackGraph.addDependency(consumerStack, producerStack);
        LOG.debug("{} imports {} from {}", consumerStack.stackName(), export.exportName(), producerStack.stackName());
        return Fn.intrinsic(Fn.IMPORT_VALUE, export.exportName());
    }

    public ExportRegistry exportsOf(Stack stack) {
        return registries.computeIfAbsent(stack, ExportRegistry::new);
    }

    /**
     * How the producer's own stack refers to {@code attribute} of {@code producer}.
     */
    public Object localExpression(Construct producer, String attribute) {
        if (!(producer instanceof EntityEmitter emitter) || emitter.section() == TemplateSection.OUTPUTS) {
            throw new IllegalArgumentException("'" + producer.pathString() + "' cannot be referenced");
        }
        var logicalId = allocators.apply(producer.stack()).allocate(producer);
        if (Token.REF_ATTRIBUTE.equals(attribute)) {
            return Fn.intrinsic(Fn.REF, logicalId);
        }
        if (emitter.section() != TemplateSection.RESOURCES) {
            throw new IllegalArgumentException(
                "'" + producer.pathString() + "' only supports Ref, not attribute '" + attribute + "'"
            );
        }
        return Fn.intrinsic(Fn.GET_ATT, List.of(logicalId, attribute));
    }

    /**
     * Output keys keep only the alphanumerics of the attribute. When two attributes of the same
     * producer flatten to the same key, the later one gets a hash of its raw name appended.
     */
    private Export newExport(Reference reference, ExportRegistry registry) {
        var logicalId = allocators.apply(reference.producerStack()).allocate(reference.producer());
        var kind = Token.REF_ATTRIBUTE.equals(reference.attribute())
            ? "Ref"
            : "FnGetAtt";
        var suffix = Token.REF_ATTRIBUTE.equals(reference.attribute())
            ? ""
            : reference.attribute().replaceAll("[^A-Za-z0-9]", "");
        var outputKey = EXPORT_PREFIX + kind + logicalId + suffix;
        if (registry.hasOutputKey(outputKey)) {
            outputKey = outputKey + LogicalIds.pathHash(List.of(reference.attribute()));
        }
        var exportName = reference.producerStack().stackName() + ":" + outputKey;
        return new Export(outputKey, exportName, reference.producerExpression(), reference);
    }

    private static void ensureLinkable(Stack producerStack, Stack consumerStack, Construct producer) {
        var producerRoot = producerStack.root();
        if (producerRoot != consumerStack.root() || !(producerRoot instanceof App)) {
            throw new UnresolvableReferenceException(
                "'" + producer.pathString() + "' is referenced from stack '" + consumerStack.pathString()
                    + "' which does not share its app"
            );
        }
        if (producerStack.environment().conflictsWith(consumerStack.environment())) {
            throw new UnresolvableReferenceException(
                "Stack '" + consumerStack.stackName() + "' (" + consumerStack.environment()
                    + ") cannot import from stack '" + producerStack.stackName() + "' ("
                    + producerStack.environment() + "): environments differ"
            );
        }
    }
}
