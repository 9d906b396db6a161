package work.lcod.synth.id;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class LogicalIdsTest {
    @Test
    void readablePrefixPlusPathHash() {
        var id = LogicalIds.of(List.of("Website", "Bucket"));
        assertEquals("WebsiteBucket" + LogicalIds.pathHash(List.of("Website", "Bucket")), id);
        assertTrue(id.matches("WebsiteBucket[0-9A-F]{8}"));
        assertEquals(id, LogicalIds.of(List.of("Website", "Bucket")));
    }

    @Test
    void defaultComponentIsHiddenFromThePrefixButHashed() {
        var direct = LogicalIds.of(List.of("Bucket"));
        var wrapped = LogicalIds.of(List.of("Default", "Bucket"));

        assertTrue(wrapped.matches("Bucket[0-9A-F]{8}"));
        assertEquals("Bucket" + LogicalIds.pathHash(List.of("Default", "Bucket")), wrapped);
        assertNotEquals(direct, wrapped);
    }

    @Test
    void resourceComponentOnlyAffectsTheHash() {
        var plain = LogicalIds.of(List.of("Bucket"));
        var wrapped = LogicalIds.of(List.of("Bucket", "Resource"));
        assertTrue(wrapped.startsWith("Bucket"));
        assertEquals("Bucket".length() + LogicalIds.HASH_LENGTH, wrapped.length());
        assertNotEquals(plain, wrapped);
    }

    @Test
    void stripsNonAlphanumericCharactersAndRepeatedComponents() {
        var id = LogicalIds.of(List.of("my-site", "my-site", "assets_bucket"));
        assertTrue(id.startsWith("mysiteassetsbucket"));
        assertEquals("mysiteassetsbucket".length() + LogicalIds.HASH_LENGTH, id.length());
    }

    @Test
    void longPathsAreCappedAtMaximumLength() {
        var component = String.join("", Collections.nCopies(100, "Segment"));
        var id = LogicalIds.of(List.of(component, "Child"));
        assertEquals(LogicalIds.MAX_ID_LENGTH, id.length());
    }

    @Test
    void emptyPathsHaveNoId() {
        assertThrows(IllegalArgumentException.class, () -> LogicalIds.of(List.of()));
    }
}
