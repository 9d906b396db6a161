package work.lcod.synth.select;

import java.util.Objects;

/**
 * Embedding-application policy for placement queries.
 */
public record SelectionPolicy(String defaultCategory) {
    public static final String DEFAULT_CATEGORY = "Private";

    public SelectionPolicy {
        Objects.requireNonNull(defaultCategory, "defaultCategory");
    }

    public static SelectionPolicy defaults() {
        return new SelectionPolicy(DEFAULT_CATEGORY);
    }
}
