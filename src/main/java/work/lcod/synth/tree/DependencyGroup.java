package work.lcod.synth.tree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Lets a plain list of dependables act as one dependable. Elements may be appended after the
 * group was handed out; dependents see the final contents at synthesis time.
 */
public final class DependencyGroup implements Dependable {
    private final List<Dependable> members = new ArrayList<>();

    public DependencyGroup(Dependable... members) {
        Collections.addAll(this.members, members);
    }

    public DependencyGroup add(Dependable member) {
        members.add(member);
        return this;
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    @Override
    public Collection<? extends Construct> dependencyElements() {
        var elements = new LinkedHashSet<Construct>();
        for (Dependable member : members) {
            elements.addAll(member.dependencyElements());
        }
        return List.copyOf(elements);
    }
}
