package work.lcod.synth.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.synth.resource.CfnElement;
import work.lcod.synth.resource.CfnOutput;
import work.lcod.synth.resource.CfnParameter;
import work.lcod.synth.resource.CfnResource;
import work.lcod.synth.resource.SelectableResource;
import work.lcod.synth.select.NodeSelector;
import work.lcod.synth.select.PlacementQuery;
import work.lcod.synth.select.QueryMode;
import work.lcod.synth.select.SelectionPolicy;
import work.lcod.synth.token.Fn;
import work.lcod.synth.token.Token;
import work.lcod.synth.tree.App;
import work.lcod.synth.tree.Construct;
import work.lcod.synth.tree.Environment;
import work.lcod.synth.tree.Stack;
import work.lcod.synth.tree.StackProps;

/**
 * Builds a construct tree from a declarative YAML or JSON model.
 *
 * <p>Constructs are created first; property values, outputs and dependencies are wired in a
 * second pass so expressions may point at constructs declared later in the file. Paths in
 * expressions are relative to the app ({@code StackA/Bucket}).
 */
public final class ModelLoader {
    private static final Logger LOG = LoggerFactory.getLogger(ModelLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ModelLoader() {}

    public static App loadFromLocalFile(Path path) {
        return loadFromLocalFile(path, SelectionPolicy.defaults());
    }

    public static App loadFromLocalFile(Path path, SelectionPolicy policy) {
        try (var in = Files.newInputStream(path)) {
            var app = load(in, policy);
            LOG.debug("Loaded model {} with {} stack(s)", path, app.stacks().size());
            return app;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read model: " + path, ex);
        }
    }

    public static App load(InputStream in, SelectionPolicy policy) throws IOException {
        var root = YAML_MAPPER.readTree(in);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Model must be an object with an 'app' and 'stacks'");
        }
        return new Builder(policy).build(convertObject(root));
    }

    private static Map<String, Object> convertObject(JsonNode node) {
        var map = new LinkedHashMap<String, Object>();
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            map.put(entry.getKey(), convertNode(entry.getValue()));
        }
        return map;
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            return convertObject(node);
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }

    /**
     * Holds the pending second-pass work of one load.
     */
    private static final class Builder {
        private final List<Runnable> wiring = new ArrayList<>();
        private final SelectionPolicy policy;
        private App app;

        Builder(SelectionPolicy policy) {
            this.policy = policy == null ? SelectionPolicy.defaults() : policy;
        }

        App build(Map<String, Object> model) {
            var appId = stringOr(model.get("app"), App.DEFAULT_ID);
            app = new App(appId);
            var stacks = list(model.get("stacks"), "stacks");
            for (int i = 0; i < stacks.size(); i++) {
                buildStack(object(stacks.get(i), "stacks[" + i + "]"), "stacks[" + i + "]");
            }
            wiring.forEach(Runnable::run);
            return app;
        }

        private void buildStack(Map<String, Object> definition, String where) {
            var id = requiredString(definition, "id", where);
            var props = StackProps.defaults().withStackName(stringOr(definition.get("stackName"), null));
            if (definition.get("env") != null) {
                var env = object(definition.get("env"), where + ".env");
                props = props.withEnvironment(Environment.of(
                    stringOr(env.get("account"), null),
                    stringOr(env.get("region"), null)
                ));
            }
            var stack = new Stack(app, id, props);
            buildMembers(stack, definition, where);
        }

        private void buildMembers(Construct scope, Map<String, Object> definition, String where) {
            var parameters = list(definition.get("parameters"), where + ".parameters");
            for (int i = 0; i < parameters.size(); i++) {
                var at = where + ".parameters[" + i + "]";
                var param = object(parameters.get(i), at);
                new CfnParameter(
                    scope,
                    requiredString(param, "id", at),
                    stringOr(param.get("type"), "String"),
                    param.get("default"),
                    stringOr(param.get("description"), null)
                );
            }

            var resources = list(definition.get("resources"), where + ".resources");
            for (int i = 0; i < resources.size(); i++) {
                var at = where + ".resources[" + i + "]";
                var res = object(resources.get(i), at);
                var resource = newResource(scope, res, at);
                var logicalId = stringOr(res.get("logicalId"), null);
                if (logicalId != null) {
                    resource.overrideLogicalId(logicalId);
                }
                var properties = res.get("properties") == null ? Map.<String, Object>of() : object(res.get("properties"), at + ".properties");
                wiring.add(() -> properties.forEach((name, value) -> resource.setProperty(name, convertValue(value, at))));
                wireDependencies(resource, res.get("dependsOn"), at);
            }

            var constructs = list(definition.get("constructs"), where + ".constructs");
            for (int i = 0; i < constructs.size(); i++) {
                var at = where + ".constructs[" + i + "]";
                var child = object(constructs.get(i), at);
                var group = new ModelGroup(scope, requiredString(child, "id", at));
                buildMembers(group, child, at);
            }

            var outputs = list(definition.get("outputs"), where + ".outputs");
            for (int i = 0; i < outputs.size(); i++) {
                var at = where + ".outputs[" + i + "]";
                var out = object(outputs.get(i), at);
                var id = requiredString(out, "id", at);
                if (!out.containsKey("value")) {
                    throw new IllegalArgumentException(at + ": 'value' is required");
                }
                wiring.add(() -> new CfnOutput(
                    scope,
                    id,
                    convertValue(out.get("value"), at),
                    stringOr(out.get("description"), null),
                    stringOr(out.get("exportName"), null)
                ));
            }

            if (scope instanceof Stack || scope instanceof ModelGroup) {
                wireDependencies(scope, definition.get("dependsOn"), where);
            }
        }

        private CfnResource newResource(Construct scope, Map<String, Object> res, String at) {
            var id = requiredString(res, "id", at);
            var type = requiredString(res, "type", at);
            if (res.get("placement") == null) {
                return new CfnResource(scope, id, type);
            }
            var placement = object(res.get("placement"), at + ".placement");
            return new SelectableResource(
                scope,
                id,
                type,
                requiredString(placement, "category", at + ".placement"),
                stringOr(placement.get("group"), null)
            );
        }

        private void wireDependencies(Construct construct, Object raw, String where) {
            var targets = list(raw, where + ".dependsOn");
            if (targets.isEmpty()) {
                return;
            }
            wiring.add(() -> {
                for (Object target : targets) {
                    construct.addDependency(lookup(String.valueOf(target), where));
                }
            });
        }

        private Object convertValue(Object value, String where) {
            if (value instanceof Map<?, ?> map) {
                if (map.size() == 1) {
                    var key = String.valueOf(map.keySet().iterator().next());
                    if (key.startsWith("$")) {
                        return expression(key, map.get(key), where);
                    }
                }
                var copy = new LinkedHashMap<String, Object>();
                for (var entry : map.entrySet()) {
                    copy.put(String.valueOf(entry.getKey()), convertValue(entry.getValue(), where));
                }
                return copy;
            }
            if (value instanceof List<?> items) {
                var copy = new ArrayList<Object>(items.size());
                for (Object item : items) {
                    copy.add(convertValue(item, where));
                }
                return copy;
            }
            return value;
        }

        private Object expression(String name, Object argument, String where) {
            switch (name) {
                case "$ref":
                    return attribute(lookup(String.valueOf(argument), where), Token.REF_ATTRIBUTE, where);
                case "$getAtt": {
                    var args = arguments(argument, 2, name, where);
                    return attribute(lookup(String.valueOf(args.get(0)), where), String.valueOf(args.get(1)), where);
                }
                case "$join": {
                    var args = arguments(argument, 2, name, where);
                    return Fn.join(String.valueOf(args.get(0)), (List<?>) convertValue(list(args.get(1), where + "." + name), where));
                }
                case "$concat":
                    return Fn.join("", (List<?>) convertValue(list(argument, where + "." + name), where));
                case "$split": {
                    var args = arguments(argument, 2, name, where);
                    return Fn.split(String.valueOf(args.get(0)), convertValue(args.get(1), where));
                }
                case "$select": {
                    var args = arguments(argument, 2, name, where);
                    if (!(args.get(0) instanceof Number index)) {
                        throw new IllegalArgumentException(where + ": $select index must be a number");
                    }
                    return Fn.select(index.intValue(), convertValue(args.get(1), where));
                }
                case "$importValue":
                    return Fn.importValue(convertValue(argument, where));
                case "$placement":
                    return placement(object(argument, where + "." + name), where);
                default:
                    throw new IllegalArgumentException(where + ": unknown expression '" + name + "'");
            }
        }

        /**
         * {@code {$placement: {within, category?, group?, allowEmpty?}}} becomes the list of
         * {@code Ref}s of the matching selectable resources.
         */
        private List<Object> placement(Map<String, Object> definition, String where) {
            var scope = lookup(requiredString(definition, "within", where + ".$placement"), where);
            var query = new PlacementQuery(
                Optional.ofNullable(definition.get("category")).map(String::valueOf),
                Optional.ofNullable(definition.get("group")).map(String::valueOf)
            );
            var mode = Boolean.TRUE.equals(definition.get("allowEmpty")) ? QueryMode.ALLOW_NONE : QueryMode.REQUIRED;
            var selected = NodeSelector.<SelectableResource>within(scope, policy).select(query, mode);
            var refs = new ArrayList<Object>(selected.size());
            for (SelectableResource resource : selected) {
                refs.add(resource.ref());
            }
            return refs;
        }

        private Token attribute(Construct target, String attribute, String where) {
            if (!(target instanceof CfnElement element)) {
                throw new IllegalArgumentException(where + ": '" + target.pathString() + "' cannot be referenced");
            }
            return element.reference(attribute);
        }

        private Construct lookup(String path, String where) {
            try {
                return app.findByPath(path);
            } catch (RuntimeException ex) {
                throw new IllegalArgumentException(where + ": " + ex.getMessage(), ex);
            }
        }

        private static List<Object> arguments(Object raw, int size, String name, String where) {
            var args = list(raw, where + "." + name);
            if (args.size() != size) {
                throw new IllegalArgumentException(where + ": " + name + " expects " + size + " arguments, got " + args.size());
            }
            return args;
        }

        @SuppressWarnings("unchecked")
        private static List<Object> list(Object raw, String where) {
            if (raw == null) {
                return List.of();
            }
            if (raw instanceof List<?> items) {
                return (List<Object>) items;
            }
            throw new IllegalArgumentException(where + " must be a list");
        }

        @SuppressWarnings("unchecked")
        private static Map<String, Object> object(Object raw, String where) {
            if (raw instanceof Map<?, ?> map) {
                return (Map<String, Object>) map;
            }
            throw new IllegalArgumentException(where + " must be an object");
        }

        private static String requiredString(Map<String, Object> definition, String key, String where) {
            var value = definition.get(key);
            if (!(value instanceof String str) || str.isBlank()) {
                throw new IllegalArgumentException(where + ": '" + key + "' is required");
            }
            return str;
        }

        private static String stringOr(Object value, String fallback) {
            return value == null ? fallback : String.valueOf(value);
        }
    }

    /**
     * Plain grouping construct declared under {@code constructs}.
     */
    static final class ModelGroup extends Construct {
        ModelGroup(Construct scope, String id) {
            super(scope, id);
        }
    }
}
