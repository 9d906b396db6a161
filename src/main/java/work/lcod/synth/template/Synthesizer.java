package work.lcod.synth.template;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.synth.id.AllocationException;
import work.lcod.synth.resource.EntityEmitter;
import work.lcod.synth.resource.TemplateSection;
import work.lcod.synth.tree.App;
import work.lcod.synth.tree.Construct;
import work.lcod.synth.tree.Dependable;
import work.lcod.synth.tree.Stack;

/**
 * Turns a construct tree into one template per stack.
 *
 * <p>The run locks the tree, resolves every emitted entity (allocating logical ids, recording
 * implicit and explicit edges and cross-stack exports along the way), rejects cycles, and
 * finally assembles the stacks in dependency order. Any failure aborts the whole run.
 */
public final class Synthesizer {
    private static final Logger LOG = LoggerFactory.getLogger(Synthesizer.class);

    private final TemplateAssembler assembler = new TemplateAssembler();

    public CloudAssembly synthesize(App app) {
        app.lock();
        var stacks = app.stacks();
        ensureUniqueStackNames(stacks);

        var session = new SynthesisSession();
        var emittersByStack = collectEmitters(app, stacks, session);

        var resolved = new HashMap<EntityEmitter, ResolvedEntity>();
        for (Stack stack : stacks) {
            addStackDependencies(stack, session);
            for (EntityEmitter emitter : emittersByStack.get(stack)) {
                resolved.put(emitter, resolve(emitter, stack, session));
            }
            LOG.debug("Resolved {} entities of stack {}", emittersByStack.get(stack).size(), stack.stackName());
        }

        var constructOrder = session.constructGraph().topologicalOrder();
        var stackOrder = session.stackGraph().topologicalOrder();

        var artifacts = new ArrayList<StackArtifact>(stackOrder.size());
        for (Stack stack : stackOrder) {
            var entities = new ArrayList<ResolvedEntity>();
            for (Construct construct : constructOrder) {
                var entity = construct instanceof EntityEmitter emitter ? resolved.get(emitter) : null;
                if (entity != null && construct.stack() == stack) {
                    entities.add(entity);
                }
            }
            var dependencies = new ArrayList<String>();
            for (Stack candidate : stackOrder) {
                if (session.stackGraph().dependenciesOf(stack).contains(candidate)) {
                    dependencies.add(candidate.stackName());
                }
            }
            artifacts.add(assembler.assemble(stack, entities, session.references().exportsOf(stack), dependencies));
        }
        LOG.info(
            "Synthesized {} stack(s) of app {} ({} tokens resolved)",
            artifacts.size(),
            app.id(),
            session.resolver().cachedTokenCount()
        );
        return new CloudAssembly(artifacts);
    }

    private static void ensureUniqueStackNames(List<Stack> stacks) {
        var seen = new HashMap<String, Stack>();
        for (Stack stack : stacks) {
            var previous = seen.putIfAbsent(stack.stackName(), stack);
            if (previous != null) {
                throw new AllocationException(
                    "Stack name '" + stack.stackName() + "' is used by both '" + previous.pathString()
                        + "' and '" + stack.pathString() + "'"
                );
            }
        }
    }

    private static Map<Stack, List<EntityEmitter>> collectEmitters(App app, List<Stack> stacks, SynthesisSession session) {
        var byStack = new LinkedHashMap<Stack, List<EntityEmitter>>();
        for (Stack stack : stacks) {
            byStack.put(stack, new ArrayList<>());
            session.stackGraph().addNode(stack);
        }
        for (Construct construct : app.findAll()) {
            if (construct instanceof EntityEmitter emitter) {
                byStack.get(construct.stack()).add(emitter);
                session.constructGraph().addNode(construct);
            }
        }
        return byStack;
    }

    @SuppressWarnings("unchecked")
    private static ResolvedEntity resolve(EntityEmitter emitter, Stack stack, SynthesisSession session) {
        var construct = (Construct) emitter;
        var logicalId = session.allocator(stack).allocate(construct);
        var entity = emitter.entity();
        var properties = (Map<String, Object>) session.resolver().resolve(entity.properties(), construct);

        var dependsOn = new TreeSet<String>();
        for (Construct target : explicitTargets(construct, stack)) {
            var targetStack = target.stack();
            if (targetStack != stack) {
                session.stackGraph().addDependency(stack, targetStack);
            }
            if (target instanceof EntityEmitter) {
                session.constructGraph().addDependency(construct, target);
                if (targetStack == stack && isResource(emitter) && isResource((EntityEmitter) target)) {
                    dependsOn.add(session.allocator(stack).allocate(target));
                }
            }
        }
        return new ResolvedEntity(emitter, logicalId, entity.type(), properties, List.copyOf(dependsOn));
    }

    /**
     * Explicit dependencies declared on the emitter or on any of its ancestors inside the
     * stack, expanded to emitting constructs (or to a foreign stack when nothing inside it
     * emits).
     */
    private static Set<Construct> explicitTargets(Construct construct, Stack stack) {
        var targets = new LinkedHashSet<Construct>();
        Construct current = construct;
        while (current != null && current != stack) {
            for (Dependable dependable : current.dependencies()) {
                for (Construct element : dependable.dependencyElements()) {
                    expand(element, targets);
                }
            }
            current = current.scope().orElse(null);
        }
        return targets;
    }

    private static void expand(Construct element, Set<Construct> targets) {
        boolean found = false;
        for (Construct candidate : element.findAll()) {
            if (candidate instanceof EntityEmitter) {
                targets.add(candidate);
                found = true;
            }
        }
        if (!found) {
            targets.add(element.stack());
        }
    }

    private static void addStackDependencies(Stack stack, SynthesisSession session) {
        for (Dependable dependable : stack.dependencies()) {
            for (Construct element : dependable.dependencyElements()) {
                var target = element.stack();
                if (target != stack) {
                    session.stackGraph().addDependency(stack, target);
                }
            }
        }
    }

    private static boolean isResource(EntityEmitter emitter) {
        return emitter.section() == TemplateSection.RESOURCES;
    }
}
