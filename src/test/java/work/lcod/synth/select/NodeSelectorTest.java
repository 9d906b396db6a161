package work.lcod.synth.select;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.synth.support.SynthTestSupport.group;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.synth.resource.SelectableResource;
import work.lcod.synth.tree.App;
import work.lcod.synth.tree.Construct;
import work.lcod.synth.tree.Stack;

class NodeSelectorTest {
    private Construct vpc;
    private SelectableResource publicA;
    private SelectableResource privateA;
    private SelectableResource privateB;
    private SelectableResource isolated;

    @BeforeEach
    void setUp() {
        var stack = new Stack(new App(), "Network");
        vpc = group(stack, "Vpc");
        publicA = subnet("PublicA", "Public", "Ingress");
        privateA = subnet("PrivateA", "Private", "App");
        privateB = subnet("PrivateB", "Private", "App");
        isolated = subnet("IsolatedA", "Isolated", "Data");
    }

    @Test
    void defaultsToThePolicyCategory() {
        var selector = NodeSelector.<SelectableResource>within(vpc, SelectionPolicy.defaults());
        assertEquals(List.of(privateA, privateB), selector.select(PlacementQuery.defaults()));
        assertEquals(List.of(privateA, privateB), selector.select(null));
    }

    @Test
    void policyChangesTheDefaultCategory() {
        var selector = NodeSelector.<SelectableResource>within(vpc, new SelectionPolicy("Isolated"));
        assertEquals(List.of(isolated), selector.select(PlacementQuery.defaults()));
    }

    @Test
    void selectsByCategoryOrGroupName() {
        var selector = NodeSelector.<SelectableResource>within(vpc, SelectionPolicy.defaults());
        assertEquals(List.of(publicA), selector.select(PlacementQuery.byCategory("Public")));
        assertEquals(List.of(isolated), selector.select(PlacementQuery.byGroupName("Data")));
    }

    @Test
    void categoryAndGroupNameTogetherAreAmbiguous() {
        var selector = NodeSelector.<SelectableResource>within(vpc, SelectionPolicy.defaults());
        var query = new PlacementQuery(Optional.of("Public"), Optional.of("Ingress"));
        assertThrows(AmbiguousSelectionException.class, () -> selector.select(query));
    }

    @Test
    void emptySelections() {
        var selector = NodeSelector.<SelectableResource>within(vpc, SelectionPolicy.defaults());
        assertThrows(EmptySelectionException.class, () -> selector.select(PlacementQuery.byCategory("Edge")));
        assertTrue(selector.select(PlacementQuery.byCategory("Edge"), QueryMode.ALLOW_NONE).isEmpty());
        assertThrows(
            EmptySelectionException.class,
            () -> selector.select(PlacementQuery.byGroupName("Missing"), QueryMode.ALLOW_NONE)
        );
    }

    @Test
    void emptyDefaultCategoryIsStillRequired() {
        var selector = NodeSelector.<SelectableResource>within(vpc, new SelectionPolicy("Edge"));
        assertThrows(EmptySelectionException.class, () -> selector.select(PlacementQuery.defaults()));
        assertTrue(selector.select(PlacementQuery.defaults(), QueryMode.ALLOW_NONE).isEmpty());
    }

    @Test
    void membershipIsByIdentity() {
        var selector = NodeSelector.<SelectableResource>within(vpc, SelectionPolicy.defaults());
        assertTrue(selector.isMember(privateA));
        assertFalse(selector.isMember(vpc));
        assertEquals(4, selector.candidates().size());
    }

    private SelectableResource subnet(String id, String category, String groupName) {
        return new SelectableResource(vpc, id, "AWS::EC2::Subnet", category, groupName);
    }
}
