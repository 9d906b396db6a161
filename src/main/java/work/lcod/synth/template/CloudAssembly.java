package work.lcod.synth.template;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.lcod.synth.tree.NodeNotFoundException;

/**
 * Result of a synthesis run: one artifact per stack, in deployment order.
 */
public final class CloudAssembly {
    public static final String MANIFEST_VERSION = "1.0.0";

    private final List<StackArtifact> stacks;

    CloudAssembly(List<StackArtifact> stacks) {
        this.stacks = List.copyOf(stacks);
    }

    public List<StackArtifact> stacks() {
        return stacks;
    }

    public Optional<StackArtifact> tryGetStack(String stackName) {
        return stacks.stream().filter(artifact -> artifact.stackName().equals(stackName)).findFirst();
    }

    public StackArtifact stack(String stackName) {
        return tryGetStack(stackName)
            .orElseThrow(() -> new NodeNotFoundException("No stack named '" + stackName + "' in the assembly"));
    }

    /**
     * Deployment manifest: artifact type, environment and stack dependencies per stack.
     */
    public Map<String, Object> manifest() {
        var artifacts = new LinkedHashMap<String, Object>();
        for (StackArtifact artifact : stacks) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("type", "aws:cloudformation:stack");
            entry.put("path", artifact.constructPath());
            var env = artifact.environment();
            entry.put("environment", "aws://" + orUnknown(env.account(), "unknown-account")
                + "/" + orUnknown(env.region(), "unknown-region"));
            if (!artifact.dependencies().isEmpty()) {
                entry.put("dependencies", artifact.dependencies());
            }
            artifacts.put(artifact.stackName(), entry);
        }
        var manifest = new LinkedHashMap<String, Object>();
        manifest.put("version", MANIFEST_VERSION);
        manifest.put("artifacts", artifacts);
        return manifest;
    }

    private static String orUnknown(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
