package work.lcod.synth.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Addressable unit of the construct tree. A construct registers itself with its scope on
 * creation; the tree is append-only until the root is locked for synthesis.
 */
public class Construct implements Addressable, Dependable {
    public static final String PATH_SEPARATOR = "/";

    private final Construct scope;
    private final String id;
    private final Map<String, Construct> children = new LinkedHashMap<>();
    private final List<Dependable> dependencies = new ArrayList<>();
    private List<String> path;
    private boolean locked;

    protected Construct(Construct scope, String id) {
        this.scope = scope;
        this.id = validateId(id);
        if (scope != null) {
            scope.addChild(this.id, this);
        }
    }

    @Override
    public String id() {
        return id;
    }

    public Optional<Construct> scope() {
        return Optional.ofNullable(scope);
    }

    public List<Construct> children() {
        return List.copyOf(children.values());
    }

    /**
     * Ids from the root down to this construct. Computed on first access.
     */
    @Override
    public List<String> path() {
        if (path == null) {
            var segments = new ArrayList<String>();
            if (scope != null) {
                segments.addAll(scope.path());
            }
            segments.add(id);
            path = Collections.unmodifiableList(segments);
        }
        return path;
    }

    public Construct root() {
        Construct current = this;
        while (current.scope != null) {
            current = current.scope;
        }
        return current;
    }

    public Optional<Construct> tryFindChild(String childId) {
        return Optional.ofNullable(children.get(childId));
    }

    public Construct findChild(String childId) {
        return tryFindChild(childId)
            .orElseThrow(() -> new NodeNotFoundException("No child '" + childId + "' under '" + pathString() + "'"));
    }

    /**
     * Looks up a descendant by a {@code /}-separated path relative to this construct.
     */
    public Construct findByPath(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new NodeNotFoundException("Empty path lookup under '" + pathString() + "'");
        }
        Construct current = this;
        for (String segment : relativePath.split(PATH_SEPARATOR)) {
            if (segment.isEmpty()) continue;
            var next = current.children.get(segment);
            if (next == null) {
                throw new NodeNotFoundException("No construct at '" + relativePath + "' under '" + pathString() + "'");
            }
            current = next;
        }
        return current;
    }

    /**
     * Preorder traversal of this subtree, children in declaration order.
     */
    public List<Construct> findAll() {
        var result = new ArrayList<Construct>();
        var pending = new ArrayDeque<Construct>();
        pending.push(this);
        while (!pending.isEmpty()) {
            var current = pending.pop();
            result.add(current);
            var kids = new ArrayList<>(current.children.values());
            Collections.reverse(kids);
            kids.forEach(pending::push);
        }
        return result;
    }

    /**
     * Nearest construct, starting with this one and walking up, that satisfies the predicate.
     */
    public Construct findAncestor(Predicate<? super Construct> predicate) {
        return tryFindAncestor(predicate)
            .orElseThrow(() -> new NodeNotFoundException("No ancestor of '" + pathString() + "' matches the requested capability"));
    }

    public <T> T findAncestor(Class<T> kind) {
        return tryFindAncestor(kind::isInstance)
            .map(kind::cast)
            .orElseThrow(() -> new NodeNotFoundException(
                "'" + pathString() + "' is not defined within a " + kind.getSimpleName()
            ));
    }

    public Optional<Construct> tryFindAncestor(Predicate<? super Construct> predicate) {
        Construct current = this;
        while (current != null) {
            if (predicate.test(current)) {
                return Optional.of(current);
            }
            current = current.scope;
        }
        return Optional.empty();
    }

    /**
     * Enclosing aggregation boundary.
     */
    public Stack stack() {
        return findAncestor(Stack.class);
    }

    public void addDependency(Dependable... targets) {
        ensureUnlocked();
        for (Dependable target : targets) {
            if (target != null && !dependencies.contains(target)) {
                dependencies.add(target);
            }
        }
    }

    public List<Dependable> dependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    @Override
    public Collection<? extends Construct> dependencyElements() {
        return List.of(this);
    }

    public boolean isLocked() {
        return root().locked;
    }

    protected void lock() {
        root().locked = true;
    }

    protected final void ensureUnlocked() {
        if (isLocked()) {
            throw new IllegalStateException("Cannot modify '" + pathString() + "': the tree is locked for synthesis");
        }
    }

    void addChild(String childId, Construct child) {
        ensureUnlocked();
        if (children.containsKey(childId)) {
            throw new DuplicateIdException(pathString(), childId);
        }
        children.put(childId, child);
    }

    @Override
    public String toString() {
        return pathString();
    }

    private static String validateId(String id) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Construct id must be a non-empty string");
        }
        if (id.contains(PATH_SEPARATOR)) {
            throw new IllegalArgumentException("Construct id '" + id + "' must not contain '" + PATH_SEPARATOR + "'");
        }
        return id;
    }
}
