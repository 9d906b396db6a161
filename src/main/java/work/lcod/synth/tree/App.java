package work.lcod.synth.tree;

import java.util.List;

/**
 * Root of a construct tree. Stacks declared anywhere below it are synthesized together.
 */
public class App extends Construct {
    public static final String DEFAULT_ID = "App";

    public App() {
        this(DEFAULT_ID);
    }

    public App(String id) {
        super(null, id);
    }

    /**
     * Stacks of this app in declaration (preorder) order.
     */
    public List<Stack> stacks() {
        return findAll().stream()
            .filter(Stack.class::isInstance)
            .map(Stack.class::cast)
            .toList();
    }

    /**
     * Freezes the tree. Synthesis calls this before reading anything.
     */
    @Override
    public void lock() {
        super.lock();
    }
}
