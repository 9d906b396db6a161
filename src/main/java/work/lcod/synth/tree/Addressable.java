package work.lcod.synth.tree;

import java.util.List;

/**
 * Capability of being located in the construct tree.
 */
public interface Addressable {
    String id();

    List<String> path();

    default String pathString() {
        return String.join(Construct.PATH_SEPARATOR, path());
    }
}
