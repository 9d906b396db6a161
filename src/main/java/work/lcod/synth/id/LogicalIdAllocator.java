package work.lcod.synth.id;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import work.lcod.synth.tree.Construct;
import work.lcod.synth.tree.Stack;

/**
 * Assigns logical ids inside one stack. Ids are computed on first request and memoized; a
 * second path landing on an id already handed out is an integrity failure.
 */
public final class LogicalIdAllocator {
    private final Stack stack;
    private final Function<Construct, String> overrides;
    private final Map<Construct, String> allocated = new HashMap<>();
    private final Map<String, Construct> owners = new HashMap<>();

    public LogicalIdAllocator(Stack stack) {
        this(stack, construct -> null);
    }

    /**
     * @param overrides returns a fixed id for a construct, or {@code null} to derive one
     */
    public LogicalIdAllocator(Stack stack, Function<Construct, String> overrides) {
        this.stack = Objects.requireNonNull(stack, "stack");
        this.overrides = Objects.requireNonNull(overrides, "overrides");
    }

    public String allocate(Construct construct) {
        var existing = allocated.get(construct);
        if (existing != null) {
            return existing;
        }
        if (construct.stack() != stack) {
            throw new IllegalArgumentException(
                "'" + construct.pathString() + "' does not belong to stack '" + stack.pathString() + "'"
            );
        }
        var override = overrides.apply(construct);
        var id = override != null ? override : LogicalIds.of(relativePath(construct));
        var owner = owners.putIfAbsent(id, construct);
        if (owner != null && owner != construct) {
            throw new AllocationException(
                "Logical id '" + id + "' of '" + construct.pathString()
                    + "' collides with '" + owner.pathString() + "'"
            );
        }
        allocated.put(construct, id);
        return id;
    }

    public Stack stack() {
        return stack;
    }

    /**
     * Path components below the stack.
     */
    List<String> relativePath(Construct construct) {
        var full = construct.path();
        var stackDepth = stack.path().size();
        if (full.size() <= stackDepth) {
            throw new IllegalArgumentException("A stack has no logical id of its own: " + construct.pathString());
        }
        return full.subList(stackDepth, full.size());
    }
}
