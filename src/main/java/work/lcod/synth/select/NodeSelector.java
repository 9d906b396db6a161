package work.lcod.synth.select;

import java.util.List;
import java.util.Objects;
import work.lcod.synth.tree.Construct;

/**
 * Picks nodes out of a fixed candidate list. Candidates keep their declaration order.
 */
public final class NodeSelector<T extends Construct & Selectable> {
    private final String owner;
    private final List<T> candidates;
    private final SelectionPolicy policy;

    public NodeSelector(String owner, List<T> candidates, SelectionPolicy policy) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.candidates = List.copyOf(candidates);
        this.policy = policy == null ? SelectionPolicy.defaults() : policy;
    }

    /**
     * Collects every {@link Selectable} construct below {@code scope}.
     */
    @SuppressWarnings("unchecked")
    public static <T extends Construct & Selectable> NodeSelector<T> within(Construct scope, SelectionPolicy policy) {
        var found = scope.findAll().stream()
            .filter(Selectable.class::isInstance)
            .map(construct -> (T) construct)
            .toList();
        return new NodeSelector<>(scope.pathString(), found, policy);
    }

    public List<T> select(PlacementQuery query) {
        return select(query, QueryMode.REQUIRED);
    }

    public List<T> select(PlacementQuery query, QueryMode mode) {
        var effective = query == null ? PlacementQuery.defaults() : query;
        if (effective.category().isPresent() && effective.groupName().isPresent()) {
            throw new AmbiguousSelectionException(
                "At most one of category and group name can be supplied when selecting in '" + owner + "'"
            );
        }
        if (effective.groupName().isPresent()) {
            var name = effective.groupName().get();
            var byName = candidates.stream().filter(candidate -> name.equals(candidate.groupName())).toList();
            if (byName.isEmpty()) {
                throw new EmptySelectionException("No nodes with group name '" + name + "' in '" + owner + "'");
            }
            return byName;
        }
        var category = effective.category().orElse(policy.defaultCategory());
        var byCategory = candidates.stream().filter(candidate -> category.equals(candidate.category())).toList();
        if (mode == QueryMode.REQUIRED && byCategory.isEmpty()) {
            throw new EmptySelectionException(
                "No nodes of category '" + category + "' in '" + owner + "'. Please select a different category."
            );
        }
        return byCategory;
    }

    /**
     * Identity membership: a different object describing the same node does not count.
     */
    public boolean isMember(Object node) {
        for (T candidate : candidates) {
            if (candidate == node) {
                return true;
            }
        }
        return false;
    }

    public List<T> candidates() {
        return candidates;
    }
}
