package work.lcod.synth.tree;

/**
 * Optional stack settings. A {@code null} stack name falls back to the stack id.
 */
public record StackProps(String stackName, Environment environment) {
    public StackProps {
        environment = environment == null ? Environment.agnostic() : environment;
    }

    public static StackProps defaults() {
        return new StackProps(null, Environment.agnostic());
    }

    public StackProps withStackName(String name) {
        return new StackProps(name, environment);
    }

    public StackProps withEnvironment(Environment env) {
        return new StackProps(stackName, env);
    }
}
