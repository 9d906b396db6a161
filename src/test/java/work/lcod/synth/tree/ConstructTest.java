package work.lcod.synth.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.synth.support.SynthTestSupport.group;

import java.util.List;
import org.junit.jupiter.api.Test;

class ConstructTest {
    @Test
    void pathStartsAtTheRoot() {
        var app = new App();
        var stack = new Stack(app, "Network");
        var vpc = group(stack, "Vpc");
        var subnet = group(vpc, "Subnet1");

        assertEquals(List.of("App", "Network", "Vpc", "Subnet1"), subnet.path());
        assertEquals("App/Network/Vpc/Subnet1", subnet.pathString());
        assertSame(subnet.path(), subnet.path());
        assertSame(app, subnet.root());
    }

    @Test
    void rejectsDuplicateSiblingIds() {
        var app = new App();
        var stack = new Stack(app, "Main");
        group(stack, "Queue");

        var ex = assertThrows(DuplicateIdException.class, () -> group(stack, "Queue"));
        assertEquals("duplicate_id", ex.code());
        assertEquals("Queue", ex.duplicateId());
        assertEquals("App/Main", ex.scopePath());
    }

    @Test
    void sameIdUnderDifferentScopesIsAllowed() {
        var app = new App();
        var stack = new Stack(app, "Main");
        var left = group(stack, "Left");
        var right = group(stack, "Right");

        var first = group(left, "Queue");
        var second = group(right, "Queue");
        assertFalse(first.pathString().equals(second.pathString()));
    }

    @Test
    void rejectsInvalidIds() {
        var app = new App();
        assertThrows(IllegalArgumentException.class, () -> group(app, ""));
        assertThrows(IllegalArgumentException.class, () -> group(app, "a/b"));
    }

    @Test
    void findsChildrenAndDescendantsByPath() {
        var app = new App();
        var stack = new Stack(app, "Main");
        var vpc = group(stack, "Vpc");
        var subnet = group(vpc, "Subnet1");

        assertSame(vpc, stack.findChild("Vpc"));
        assertTrue(stack.tryFindChild("Missing").isEmpty());
        assertSame(subnet, app.findByPath("Main/Vpc/Subnet1"));
        var ex = assertThrows(NodeNotFoundException.class, () -> app.findByPath("Main/Nope"));
        assertEquals("not_found", ex.code());
    }

    @Test
    void findAllIsPreorderInDeclarationOrder() {
        var app = new App();
        var stack = new Stack(app, "Main");
        var a = group(stack, "A");
        var a1 = group(a, "A1");
        var b = group(stack, "B");

        assertEquals(List.of(app, stack, a, a1, b), app.findAll());
    }

    @Test
    void ancestorSearchIncludesSelfAndFailsWithoutMatch() {
        var app = new App();
        var stack = new Stack(app, "Main");
        var inner = group(stack, "Inner");

        assertSame(stack, inner.findAncestor(Stack.class));
        assertSame(stack, stack.findAncestor(Stack.class));
        assertSame(stack, inner.stack());
        assertThrows(NodeNotFoundException.class, () -> app.stack());
        assertThrows(NodeNotFoundException.class, () -> inner.findAncestor(c -> c.id().equals("Elsewhere")));
    }

    @Test
    void nestedStackOwnsItsSubtree() {
        var app = new App();
        var parent = new Stack(app, "Parent");
        var nested = new Stack(parent, "Nested");
        var leaf = group(nested, "Leaf");

        assertSame(nested, leaf.stack());
        assertTrue(nested.owns(leaf));
        assertFalse(parent.owns(leaf));
        assertEquals(List.of(parent, nested), app.stacks());
    }

    @Test
    void lockedTreeRejectsNewChildren() {
        var app = new App();
        var stack = new Stack(app, "Main");
        app.lock();

        assertTrue(stack.isLocked());
        assertThrows(IllegalStateException.class, () -> group(stack, "Late"));
        assertThrows(IllegalStateException.class, () -> stack.addDependency(app));
    }

    @Test
    void dependenciesAreDeduplicated() {
        var app = new App();
        var stack = new Stack(app, "Main");
        var a = group(stack, "A");
        var b = group(stack, "B");

        a.addDependency(b, b);
        a.addDependency(b);
        assertEquals(List.of(b), a.dependencies());
    }

    @Test
    void dependencyGroupExpandsMembers() {
        var app = new App();
        var stack = new Stack(app, "Main");
        var a = group(stack, "A");
        var b = group(stack, "B");
        var dependencyGroup = new DependencyGroup(a);
        dependencyGroup.add(b).add(a);

        assertEquals(List.of(a, b), List.copyOf(dependencyGroup.dependencyElements()));
    }
}
