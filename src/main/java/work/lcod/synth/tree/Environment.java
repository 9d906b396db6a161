package work.lcod.synth.tree;

import java.util.Objects;

/**
 * Target account and region of a stack. A {@code null} field means "decided at deploy time".
 */
public record Environment(String account, String region) {
    private static final Environment AGNOSTIC = new Environment(null, null);

    public static Environment agnostic() {
        return AGNOSTIC;
    }

    public static Environment of(String account, String region) {
        return new Environment(account, region);
    }

    public boolean isAgnostic() {
        return account == null && region == null;
    }

    /**
     * Whether both environments pin a value for the same field and the values differ.
     */
    public boolean conflictsWith(Environment other) {
        if (other == null) {
            return false;
        }
        return differs(account, other.account) || differs(region, other.region);
    }

    private static boolean differs(String left, String right) {
        return left != null && right != null && !Objects.equals(left, right);
    }
}
