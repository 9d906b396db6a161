package work.lcod.synth.select;

import java.util.Optional;

/**
 * Selects nodes by category or by group name. At most one of the two may be set; an empty
 * query falls back to the policy's default category.
 */
public record PlacementQuery(Optional<String> category, Optional<String> groupName) {
    public PlacementQuery {
        category = category == null ? Optional.empty() : category;
        groupName = groupName == null ? Optional.empty() : groupName;
    }

    public static PlacementQuery defaults() {
        return new PlacementQuery(Optional.empty(), Optional.empty());
    }

    public static PlacementQuery byCategory(String category) {
        return new PlacementQuery(Optional.of(category), Optional.empty());
    }

    public static PlacementQuery byGroupName(String groupName) {
        return new PlacementQuery(Optional.empty(), Optional.of(groupName));
    }
}
