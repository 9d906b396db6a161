package work.lcod.synth.template;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.synth.id.AllocationException;
import work.lcod.synth.reference.Export;
import work.lcod.synth.reference.ExportRegistry;
import work.lcod.synth.resource.TemplateSection;
import work.lcod.synth.tree.Stack;

/**
 * Builds the template document of one stack from already resolved entities. Section and key
 * order only depend on the input order, so identical inputs give identical documents.
 */
final class TemplateAssembler {
    static final String STACK_DEPENDENCIES_KEY = "StackDependencies";

    StackArtifact assemble(Stack stack, List<ResolvedEntity> entities, ExportRegistry exports, List<String> dependencies) {
        var parameters = new LinkedHashMap<String, Object>();
        var resources = new LinkedHashMap<String, Object>();
        var outputs = new LinkedHashMap<String, Object>();

        for (ResolvedEntity entity : entities) {
            switch (entity.emitter().section()) {
                case PARAMETERS -> put(parameters, entity.logicalId(), parameter(entity), stack);
                case RESOURCES -> put(resources, entity.logicalId(), resource(entity), stack);
                case OUTPUTS -> put(outputs, entity.logicalId(), new LinkedHashMap<>(entity.properties()), stack);
                default -> throw new IllegalStateException("Unsupported section " + entity.emitter().section());
            }
        }
        for (Export export : exports.exports()) {
            put(outputs, export.outputKey(), exportOutput(export), stack);
        }

        var template = new LinkedHashMap<String, Object>();
        if (!dependencies.isEmpty()) {
            template.put(TemplateSection.METADATA.key(), Map.of(STACK_DEPENDENCIES_KEY, List.copyOf(dependencies)));
        }
        if (!parameters.isEmpty()) {
            template.put(TemplateSection.PARAMETERS.key(), parameters);
        }
        template.put(TemplateSection.RESOURCES.key(), resources);
        if (!outputs.isEmpty()) {
            template.put(TemplateSection.OUTPUTS.key(), outputs);
        }
        return new StackArtifact(stack.stackName(), stack.pathString(), stack.environment(), dependencies, template);
    }

    private static Map<String, Object> resource(ResolvedEntity entity) {
        var record = new LinkedHashMap<String, Object>();
        record.put("Type", entity.type());
        if (!entity.properties().isEmpty()) {
            record.put("Properties", entity.properties());
        }
        if (!entity.dependsOn().isEmpty()) {
            record.put("DependsOn", entity.dependsOn());
        }
        return record;
    }

    private static Map<String, Object> parameter(ResolvedEntity entity) {
        var record = new LinkedHashMap<String, Object>();
        record.put("Type", entity.type());
        record.putAll(entity.properties());
        return record;
    }

    private static Map<String, Object> exportOutput(Export export) {
        var record = new LinkedHashMap<String, Object>();
        record.put("Value", export.value());
        record.put("Export", Map.of("Name", export.exportName()));
        return record;
    }

    private static void put(Map<String, Object> section, String key, Object value, Stack stack) {
        if (section.putIfAbsent(key, value) != null) {
            throw new AllocationException("Duplicate key '" + key + "' in template of stack '" + stack.stackName() + "'");
        }
    }
}
