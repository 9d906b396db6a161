package work.lcod.synth.reference;

import work.lcod.synth.tree.Construct;
import work.lcod.synth.tree.Stack;

/**
 * A value produced in one stack and consumed in another. {@code producerExpression} is how the
 * producer's own template refers to the value.
 */
public record Reference(
    Construct producer,
    String attribute,
    Stack producerStack,
    Stack consumerStack,
    Object producerExpression
) {}
