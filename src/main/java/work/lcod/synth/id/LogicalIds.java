package work.lcod.synth.id;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * Pure function from a stack-relative path to a template logical id: a readable prefix built
 * from the path plus a hash of the full path.
 */
public final class LogicalIds {
    /**
     * Path component left out of the readable prefix, so a construct can be wrapped without
     * changing how its id reads. The hash still covers it.
     */
    public static final String HIDDEN_ID = "Default";

    /**
     * Path component kept in the hash but left out of the readable prefix.
     */
    public static final String HIDDEN_FROM_HUMAN_ID = "Resource";

    public static final int HASH_LENGTH = 8;
    public static final int MAX_ID_LENGTH = 255;
    private static final int MAX_HUMAN_LENGTH = MAX_ID_LENGTH - HASH_LENGTH;

    private LogicalIds() {}

    /**
     * The hash covers every component, so distinct paths never share a suffix.
     */
    public static String of(List<String> components) {
        if (components == null || components.isEmpty()) {
            throw new IllegalArgumentException("Unable to compute a logical id for an empty path");
        }
        var visible = new ArrayList<String>();
        for (String component : components) {
            if (!HIDDEN_ID.equals(component) && !HIDDEN_FROM_HUMAN_ID.equals(component)) {
                visible.add(component);
            }
        }
        var human = new StringBuilder();
        for (String component : removeConsecutiveDuplicates(visible)) {
            human.append(removeNonAlphanumeric(component));
        }
        var prefix = human.length() > MAX_HUMAN_LENGTH ? human.substring(0, MAX_HUMAN_LENGTH) : human.toString();
        return prefix + pathHash(components);
    }

    public static String pathHash(List<String> components) {
        try {
            var digest = MessageDigest.getInstance("MD5");
            var bytes = digest.digest(String.join("/", components).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, HASH_LENGTH).toUpperCase(Locale.ROOT);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("MD5 digest is not available", ex);
        }
    }

    static String removeNonAlphanumeric(String value) {
        return value.replaceAll("[^A-Za-z0-9]", "");
    }

    private static List<String> removeConsecutiveDuplicates(List<String> components) {
        var result = new ArrayList<String>();
        for (String component : components) {
            if (result.isEmpty() || !result.get(result.size() - 1).equals(component)) {
                result.add(component);
            }
        }
        return result;
    }
}
