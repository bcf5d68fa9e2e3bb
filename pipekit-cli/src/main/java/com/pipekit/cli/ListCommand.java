package com.pipekit.cli;

import com.pipekit.core.component.ComponentDescriptor;
import com.pipekit.core.component.LifecycleStage;
import com.pipekit.core.registry.ComponentRegistry;
import com.pipekit.core.registry.PipelineTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to list available components or pipeline templates.
 *
 * <p>Components are discovered via Java Service Provider Interface (SPI); for each one
 * the stages it takes part in and its package requirements are shown.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List all components
 * pipekit list components
 *
 * # List all templates
 * pipekit list templates
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available components or pipeline templates",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: components or templates"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "components", "component" -> listComponents();
            case "templates", "template" -> listTemplates();
            default -> {
                log.error("Unknown type: {}. Use: components or templates", type);
                yield 1;
            }
        };
    }

    private int listComponents() {
        System.out.println("Available Components:");
        System.out.println();

        ComponentRegistry registry = ComponentRegistry.defaultRegistry();
        for (ComponentDescriptor descriptor : registry.all()) {
            System.out.printf("  • %s%n", descriptor.name());
            for (LifecycleStage stage : LifecycleStage.values()) {
                List<String> requires = descriptor.requiresFor(stage);
                List<String> provides = descriptor.providesFor(stage);
                if (!requires.isEmpty() || !provides.isEmpty()) {
                    System.out.printf("    %-14s requires %s, provides %s%n", stage.id() + ":", requires, provides);
                }
            }
            if (!descriptor.packageRequirements().isEmpty()) {
                System.out.printf("    Requirements: %s%n", descriptor.packageRequirements());
            }
            if (descriptor.cacheable()) {
                System.out.printf("    Shared per: %s%n", descriptor.configKeys());
            }
            System.out.println();
        }

        if (registry.size() == 0) {
            System.out.println("  No components found.");
        }
        return 0;
    }

    private int listTemplates() {
        System.out.println("Available Templates:");
        System.out.println();

        for (Map.Entry<String, List<String>> template : PipelineTemplates.DEFAULTS.asMap().entrySet()) {
            System.out.printf("  • %s%n", template.getKey());
            System.out.printf("    Components: %s%n", String.join(", ", template.getValue()));
            System.out.println();
        }
        return 0;
    }
}
