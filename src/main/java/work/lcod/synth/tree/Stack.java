package work.lcod.synth.tree;

import java.util.regex.Pattern;

/**
 * Aggregation boundary: the unit of document output. Every construct belongs to the nearest
 * enclosing stack.
 */
public class Stack extends Construct {
    private static final Pattern VALID_STACK_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9-]*");

    private final String stackName;
    private final Environment environment;

    public Stack(Construct scope, String id) {
        this(scope, id, StackProps.defaults());
    }

    public Stack(Construct scope, String id, StackProps props) {
        super(scope, id);
        var effective = props == null ? StackProps.defaults() : props;
        this.stackName = effective.stackName() == null ? id : effective.stackName();
        if (!VALID_STACK_NAME.matcher(stackName).matches()) {
            throw new IllegalArgumentException(
                "Stack name '" + stackName + "' must match " + VALID_STACK_NAME.pattern()
            );
        }
        this.environment = effective.environment();
    }

    public String stackName() {
        return stackName;
    }

    public Environment environment() {
        return environment;
    }

    /**
     * Whether {@code construct} is owned by this stack rather than a nested one.
     */
    public boolean owns(Construct construct) {
        return construct.stack() == this;
    }
}
