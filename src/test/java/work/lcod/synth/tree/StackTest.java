package work.lcod.synth.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StackTest {
    @Test
    void stackNameDefaultsToId() {
        var app = new App();
        var stack = new Stack(app, "Storage");
        assertEquals("Storage", stack.stackName());
        assertTrue(stack.environment().isAgnostic());
    }

    @Test
    void explicitStackNameAndEnvironment() {
        var app = new App();
        var props = StackProps.defaults()
            .withStackName("prod-storage")
            .withEnvironment(Environment.of("123456789012", "eu-west-1"));
        var stack = new Stack(app, "Storage", props);

        assertEquals("prod-storage", stack.stackName());
        assertEquals("eu-west-1", stack.environment().region());
    }

    @Test
    void rejectsInvalidStackName() {
        var app = new App();
        var props = StackProps.defaults().withStackName("1bad_name");
        assertThrows(IllegalArgumentException.class, () -> new Stack(app, "Storage", props));
    }

    @Test
    void environmentsConflictOnlyWhenBothPinADifferentValue() {
        var pinned = Environment.of("111", "us-east-1");
        assertFalse(pinned.conflictsWith(Environment.agnostic()));
        assertFalse(pinned.conflictsWith(Environment.of(null, "us-east-1")));
        assertTrue(pinned.conflictsWith(Environment.of("111", "eu-west-1")));
        assertTrue(pinned.conflictsWith(Environment.of("222", null)));
    }
}
