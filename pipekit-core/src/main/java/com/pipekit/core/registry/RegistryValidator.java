package com.pipekit.core.registry;

import com.pipekit.core.component.ComponentDescriptor;
import com.pipekit.core.component.ComponentFactory;
import com.pipekit.core.component.LifecycleStage;
import com.pipekit.core.resolve.ArgumentResolver;
import com.pipekit.core.resolve.MissingArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Static checks over the registry and the pipeline templates.
 *
 * <p>Run by tooling (the {@code validate} command and the test suite), never per request:
 * <ul>
 *   <li>no two discovered components share a name</li>
 *   <li>every template references registered components only</li>
 *   <li>the {@value PipelineTemplates#ALL_COMPONENTS} template lists every component exactly once</li>
 *   <li>every stage's declared parameters are satisfiable from the superset context
 *       ({@link StaticContexts}) plus the configuration</li>
 *   <li>every entity extractor takes the entities found by earlier extractors</li>
 * </ul>
 */
public final class RegistryValidator {

    private static final Logger log = LoggerFactory.getLogger(RegistryValidator.class);

    private RegistryValidator() {
        // Utility class
    }

    /**
     * Runs every check.
     *
     * @param discovered raw factory list, duplicates included
     * @param templates pipeline templates
     * @param config static configuration used for soundness checks
     * @return combined report
     */
    public static ValidationReport validate(List<ComponentFactory> discovered,
                                            PipelineTemplates templates,
                                            Map<String, ?> config) {
        List<ComponentDescriptor> descriptors = discovered.stream()
            .map(ComponentFactory::descriptor)
            .toList();

        ValidationReport report = checkUniqueNames(descriptors);
        if (!report.isValid()) {
            // Registry cannot be built with duplicate names
            return report;
        }

        ComponentRegistry registry = ComponentRegistry.builder().registerAll(discovered).build();
        report = report
            .merge(checkTemplates(registry, templates))
            .merge(checkAllComponentsTemplate(registry, templates))
            .merge(checkLifecycleSoundness(registry.all(), config))
            .merge(checkExtractorsUseEntities(registry.all()));

        log.info("Validated {} components and {} templates: {} problem(s)",
            registry.size(), templates.names().size(), report.errors().size());
        return report;
    }

    /**
     * Checks that no two descriptors share a name.
     *
     * @param descriptors descriptors to check
     * @return report naming every duplicated name
     */
    public static ValidationReport checkUniqueNames(Collection<ComponentDescriptor> descriptors) {
        Map<String, Long> counts = descriptors.stream()
            .collect(Collectors.groupingBy(ComponentDescriptor::name, Collectors.counting()));
        List<String> errors = counts.entrySet().stream()
            .filter(entry -> entry.getValue() > 1)
            .map(entry -> "There is more than one component named " + entry.getKey()
                + " (" + entry.getValue() + " registrations)")
            .sorted()
            .toList();
        return new ValidationReport(errors);
    }

    /**
     * Checks that every template references registered components only.
     *
     * @param registry component registry
     * @param templates templates to check
     * @return report naming each template and unknown component
     */
    public static ValidationReport checkTemplates(ComponentRegistry registry, PipelineTemplates templates) {
        List<String> errors = new ArrayList<>();
        templates.asMap().forEach((template, components) -> components.stream()
            .filter(component -> !registry.contains(component))
            .forEach(component -> errors.add(
                "Template '" + template + "' contains unknown component: " + component)));
        return new ValidationReport(errors);
    }

    /**
     * Checks that the exhaustive template lists every registered component exactly once.
     *
     * @param registry component registry
     * @param templates templates to check
     * @return report naming missing and repeated components
     */
    public static ValidationReport checkAllComponentsTemplate(ComponentRegistry registry, PipelineTemplates templates) {
        List<String> template = templates.get(PipelineTemplates.ALL_COMPONENTS).orElse(null);
        if (template == null) {
            return new ValidationReport(List.of("Missing template: " + PipelineTemplates.ALL_COMPONENTS));
        }

        List<String> errors = new ArrayList<>();
        Map<String, Long> counts = template.stream()
            .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
        for (String name : registry.names()) {
            long count = counts.getOrDefault(name, 0L);
            if (count == 0) {
                errors.add("`" + PipelineTemplates.ALL_COMPONENTS + "` template is missing component: " + name);
            } else if (count > 1) {
                errors.add("`" + PipelineTemplates.ALL_COMPONENTS + "` template lists component "
                    + name + " " + count + " times");
            }
        }
        return new ValidationReport(errors);
    }

    /**
     * Checks that each stage's parameters are satisfiable under some ordering.
     *
     * @param descriptors every registered descriptor
     * @param config static configuration
     * @return report naming component, stage and unsatisfiable parameters
     */
    public static ValidationReport checkLifecycleSoundness(Collection<ComponentDescriptor> descriptors,
                                                           Map<String, ?> config) {
        List<String> errors = new ArrayList<>();
        for (LifecycleStage stage : LifecycleStage.values()) {
            Map<String, Object> superset = StaticContexts.superset(stage, descriptors);
            for (ComponentDescriptor descriptor : descriptors) {
                unsatisfiable(descriptor, stage, superset, config).ifPresent(errors::add);
            }
        }
        return new ValidationReport(errors);
    }

    /**
     * Checks that every entity extractor requires {@code entities} during {@code process},
     * so it extends the entities of earlier extractors instead of replacing them.
     *
     * @param descriptors every registered descriptor
     * @return report naming each offending extractor
     */
    public static ValidationReport checkExtractorsUseEntities(Collection<ComponentDescriptor> descriptors) {
        List<String> errors = descriptors.stream()
            .filter(ComponentDescriptor::isEntityExtractor)
            .filter(descriptor -> !descriptor.requiresFor(LifecycleStage.PROCESS).contains("entities"))
            .map(descriptor -> "Entity extractor " + descriptor.name()
                + " does not take previous entities during " + LifecycleStage.PROCESS.id())
            .toList();
        return new ValidationReport(errors);
    }

    /**
     * Checks one component's parameters for one stage against a superset context.
     *
     * @param descriptor component descriptor
     * @param stage lifecycle stage
     * @param superset superset context
     * @param config static configuration
     * @return error message, or empty if satisfiable
     */
    public static Optional<String> unsatisfiable(ComponentDescriptor descriptor,
                                                 LifecycleStage stage,
                                                 Map<String, ?> superset,
                                                 Map<String, ?> config) {
        try {
            ArgumentResolver.fillArgs(descriptor.requiresFor(stage), superset, config);
            return Optional.empty();
        } catch (MissingArgumentException e) {
            return Optional.of("Component " + descriptor.name() + " cannot be satisfied during "
                + stage.id() + ": missing " + e.missingNames());
        }
    }
}
