package work.lcod.synth.reference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.synth.support.SynthTestSupport.bucket;
import static work.lcod.synth.support.SynthTestSupport.group;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.synth.graph.DependencyGraph;
import work.lcod.synth.id.LogicalIdAllocator;
import work.lcod.synth.id.LogicalIds;
import work.lcod.synth.resource.CfnOutput;
import work.lcod.synth.resource.CfnParameter;
import work.lcod.synth.token.Fn;
import work.lcod.synth.token.Token;
import work.lcod.synth.tree.App;
import work.lcod.synth.tree.Environment;
import work.lcod.synth.tree.Stack;
import work.lcod.synth.tree.StackProps;

class CrossStackReferencesTest {
    private final Map<Stack, LogicalIdAllocator> allocators = new HashMap<>();
    private DependencyGraph<Stack> stackGraph;
    private CrossStackReferences references;

    @BeforeEach
    void setUp() {
        stackGraph = new DependencyGraph<>(Stack::stackName);
        references = new CrossStackReferences(stack -> allocators.computeIfAbsent(stack, LogicalIdAllocator::new), stackGraph);
    }

    @Test
    void sameStackReferencesStayLocal() {
        var stack = new Stack(new App(), "Main");
        var bucket = bucket(stack, "Bucket");
        var policy = bucket(stack, "Policy");
        var id = allocators.computeIfAbsent(stack, LogicalIdAllocator::new).allocate(bucket);

        assertEquals(Map.of(Fn.REF, id), references.resolve(policy, bucket, Token.REF_ATTRIBUTE));
        assertEquals(Map.of(Fn.GET_ATT, List.of(id, "Arn")), references.resolve(policy, bucket, "Arn"));
        assertTrue(references.exportsOf(stack).isEmpty());
        assertEquals(0, stackGraph.edgeCount());
    }

    @Test
    void crossStackReferencesExportOnceAndImport() {
        var app = new App();
        var producerStack = new Stack(app, "Producer");
        var consumerStack = new Stack(app, "Consumer");
        var bucket = bucket(producerStack, "Bucket");
        var first = bucket(consumerStack, "First");
        var second = bucket(group(consumerStack, "Nested"), "Second");
        var id = allocators.computeIfAbsent(producerStack, LogicalIdAllocator::new).allocate(bucket);

        var imported = references.resolve(first, bucket, Token.REF_ATTRIBUTE);
        assertEquals(imported, references.resolve(second, bucket, Token.REF_ATTRIBUTE));
        assertEquals(Map.of(Fn.IMPORT_VALUE, "Producer:ExportsOutputRef" + id), imported);

        var exports = references.exportsOf(producerStack).exports();
        assertEquals(1, exports.size());
        assertEquals("ExportsOutputRef" + id, exports.get(0).outputKey());
        assertEquals(Map.of(Fn.REF, id), exports.get(0).value());
        assertTrue(references.exportsOf(consumerStack).isEmpty());
        assertTrue(stackGraph.dependenciesOf(consumerStack).contains(producerStack));
    }

    @Test
    void attributeExportsAreNamedAfterTheAttribute() {
        var app = new App();
        var producerStack = new Stack(app, "Producer");
        var bucket = bucket(producerStack, "Bucket");
        var consumer = bucket(new Stack(app, "Consumer"), "Consumer");
        var id = allocators.computeIfAbsent(producerStack, LogicalIdAllocator::new).allocate(bucket);

        references.resolve(consumer, bucket, "Arn");
        references.resolve(consumer, bucket, Token.REF_ATTRIBUTE);

        var keys = references.exportsOf(producerStack).exports().stream().map(Export::outputKey).toList();
        assertEquals(List.of("ExportsOutputFnGetAtt" + id + "Arn", "ExportsOutputRef" + id), keys);
        assertEquals(Map.of(Fn.GET_ATT, List.of(id, "Arn")), references.exportsOf(producerStack).exports().get(0).value());
    }

    @Test
    void attributesThatFlattenAlikeGetDistinctExports() {
        var app = new App();
        var producerStack = new Stack(app, "Producer");
        var bucket = bucket(producerStack, "Bucket");
        var consumer = bucket(new Stack(app, "Consumer"), "Consumer");
        var id = allocators.computeIfAbsent(producerStack, LogicalIdAllocator::new).allocate(bucket);

        var dotted = references.resolve(consumer, bucket, "Endpoint.Address");
        var plain = references.resolve(consumer, bucket, "EndpointAddress");
        assertNotEquals(dotted, plain);
        assertEquals(dotted, references.resolve(consumer, bucket, "Endpoint.Address"));

        var exports = references.exportsOf(producerStack).exports();
        assertEquals(2, exports.size());
        var keys = exports.stream().map(Export::outputKey).toList();
        assertEquals(2, Set.copyOf(keys).size());
        assertTrue(keys.contains("ExportsOutputFnGetAtt" + id + "EndpointAddress"));
        assertTrue(keys.contains("ExportsOutputFnGetAtt" + id + "EndpointAddress" + LogicalIds.pathHash(List.of("EndpointAddress"))));
    }

    @Test
    void refusesReferencesAcrossApps() {
        var bucket = bucket(new Stack(new App("One"), "Producer"), "Bucket");
        var consumer = bucket(new Stack(new App("Two"), "Consumer"), "Consumer");

        var ex = assertThrows(UnresolvableReferenceException.class, () -> references.resolve(consumer, bucket, Token.REF_ATTRIBUTE));
        assertEquals("unresolvable_reference", ex.code());
    }

    @Test
    void refusesReferencesAcrossConflictingEnvironments() {
        var app = new App();
        var producerStack = new Stack(app, "Producer", StackProps.defaults().withEnvironment(Environment.of("111", "us-east-1")));
        var consumerStack = new Stack(app, "Consumer", StackProps.defaults().withEnvironment(Environment.of("111", "eu-west-1")));
        var bucket = bucket(producerStack, "Bucket");
        var consumer = bucket(consumerStack, "Consumer");

        assertThrows(UnresolvableReferenceException.class, () -> references.resolve(consumer, bucket, Token.REF_ATTRIBUTE));
        assertTrue(references.exportsOf(producerStack).isEmpty());
    }

    @Test
    void onlyResourcesSupportAttributes() {
        var stack = new Stack(new App(), "Main");
        var parameter = new CfnParameter(stack, "Env", "String");
        var output = new CfnOutput(stack, "Out", "value");
        var plain = group(stack, "Plain");
        var consumer = bucket(stack, "Consumer");

        assertTrue(references.resolve(consumer, parameter, Token.REF_ATTRIBUTE) instanceof Map<?, ?>);
        assertThrows(IllegalArgumentException.class, () -> references.resolve(consumer, parameter, "Arn"));
        assertThrows(IllegalArgumentException.class, () -> references.resolve(consumer, output, Token.REF_ATTRIBUTE));
        assertThrows(IllegalArgumentException.class, () -> references.resolve(consumer, plain, Token.REF_ATTRIBUTE));
    }
}
