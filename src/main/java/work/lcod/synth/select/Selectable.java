package work.lcod.synth.select;

/**
 * A node that placement queries can pick by category or by group name.
 */
public interface Selectable {
    String category();

    String groupName();
}
