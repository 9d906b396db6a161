package work.lcod.synth.token;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import work.lcod.synth.tree.Construct;

/**
 * Template intrinsic functions. Each helper returns a token that evaluates eagerly when its
 * inputs are concrete at synthesis time and lowers to the matching intrinsic otherwise.
 */
public final class Fn {
    public static final String REF = "Ref";
    public static final String GET_ATT = "Fn::GetAtt";
    public static final String JOIN = "Fn::Join";
    public static final String SPLIT = "Fn::Split";
    public static final String SELECT = "Fn::Select";
    public static final String IMPORT_VALUE = "Fn::ImportValue";

    private static final String INTRINSIC_PREFIX = "Fn::";

    private Fn() {}

    public static Token ref(Construct producer) {
        return Token.reference(producer, Token.REF_ATTRIBUTE);
    }

    public static Token getAtt(Construct producer, String attribute) {
        return Token.reference(producer, attribute);
    }

    public static Token join(String delimiter, Object... parts) {
        return join(delimiter, Arrays.asList(parts));
    }

    public static Token join(String delimiter, List<?> parts) {
        var delim = delimiter == null ? "" : delimiter;
        var captured = new ArrayList<Object>(parts);
        return Token.lazy("Join", TokenShape.STRING, ctx -> {
            var resolved = new ArrayList<Object>();
            for (Object part : captured) {
                var value = ctx.resolve(part);
                if (value == null) continue;
                if (value instanceof List<?> list) {
                    resolved.addAll(list);
                } else {
                    resolved.add(value);
                }
            }
            return lowerJoin(delim, resolved);
        });
    }

    /**
     * String concatenation of literals and deferred values.
     */
    public static Token concat(Object... parts) {
        return join("", parts);
    }

    public static Token split(String delimiter, Object source) {
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("split delimiter must be non-empty");
        }
        return Token.lazy("Split", TokenShape.LIST, ctx -> {
            var value = requireValue(ctx.resolve(source), "split");
            if (value instanceof String str) {
                return List.of(str.split(Pattern.quote(delimiter), -1));
            }
            return intrinsic(SPLIT, List.of(delimiter, value));
        });
    }

    public static Token select(int index, Object list) {
        if (index < 0) {
            throw new IllegalArgumentException("select index must be >= 0, got " + index);
        }
        return Token.lazy("Select", TokenShape.ANY, ctx -> {
            var value = requireValue(ctx.resolve(list), "select");
            if (value instanceof List<?> items) {
                if (index >= items.size()) {
                    throw new IllegalArgumentException(
                        "select index " + index + " is out of range for a list of " + items.size()
                    );
                }
                return items.get(index);
            }
            return intrinsic(SELECT, List.of(index, value));
        });
    }

    public static Token importValue(Object exportName) {
        return Token.lazy("ImportValue", TokenShape.STRING, ctx -> intrinsic(IMPORT_VALUE, ctx.resolve(exportName)));
    }

    /**
     * Whether {@code value} is a single-key intrinsic expression such as {@code {"Ref": ...}}.
     */
    public static boolean isIntrinsic(Object value) {
        if (!(value instanceof Map<?, ?> map) || map.size() != 1) {
            return false;
        }
        var key = String.valueOf(map.keySet().iterator().next());
        return REF.equals(key) || key.startsWith(INTRINSIC_PREFIX);
    }

    public static Map<String, Object> intrinsic(String name, Object argument) {
        var map = new LinkedHashMap<String, Object>();
        map.put(name, argument);
        return map;
    }

    static Object lowerJoin(String delimiter, List<Object> parts) {
        var flattened = new ArrayList<Object>();
        for (Object part : parts) {
            if (part == null) continue;
            var nested = nestedJoinParts(part, delimiter);
            if (nested != null) {
                flattened.addAll(nested);
            } else {
                flattened.add(isLiteral(part) ? String.valueOf(part) : part);
            }
        }
        if (flattened.stream().allMatch(String.class::isInstance)) {
            return flattened.stream().map(String.class::cast).collect(Collectors.joining(delimiter));
        }
        List<Object> lowered = delimiter.isEmpty() ? mergeAdjacentLiterals(flattened) : flattened;
        if (lowered.size() == 1) {
            return lowered.get(0);
        }
        return intrinsic(JOIN, List.of(delimiter, lowered));
    }

    private static List<Object> mergeAdjacentLiterals(List<Object> parts) {
        var merged = new ArrayList<Object>();
        var pending = new StringBuilder();
        boolean hasPending = false;
        for (Object part : parts) {
            if (part instanceof String str) {
                pending.append(str);
                hasPending = true;
                continue;
            }
            if (hasPending) {
                if (pending.length() > 0) {
                    merged.add(pending.toString());
                }
                pending.setLength(0);
                hasPending = false;
            }
            merged.add(part);
        }
        if (hasPending && pending.length() > 0) {
            merged.add(pending.toString());
        }
        return merged;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> nestedJoinParts(Object part, String delimiter) {
        if (!(part instanceof Map<?, ?> map) || !isIntrinsic(map) || !map.containsKey(JOIN)) {
            return null;
        }
        if (!(map.get(JOIN) instanceof List<?> args) || args.size() != 2) {
            return null;
        }
        if (!delimiter.equals(args.get(0)) || !(args.get(1) instanceof List<?> nested)) {
            return null;
        }
        return (List<Object>) nested;
    }

    private static Object requireValue(Object value, String function) {
        if (value == null) {
            throw new IllegalArgumentException(function + " input resolved to no value");
        }
        return value;
    }

    private static boolean isLiteral(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }
}
