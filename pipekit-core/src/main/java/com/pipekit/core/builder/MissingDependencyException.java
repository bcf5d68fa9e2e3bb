package com.pipekit.core.builder;

import com.pipekit.core.PipelineException;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Raised when a component's package requirements are not available.
 *
 * <p>When a requirements manifest is configured, the message also lists the artifacts
 * that provide each missing requirement.
 */
public class MissingDependencyException extends PipelineException {

    private final String componentName;
    private final Set<String> missingRequirements;
    private final Map<String, List<String>> installNames;

    public MissingDependencyException(String componentName,
                                      Set<String> missingRequirements,
                                      Map<String, List<String>> installNames) {
        super(buildMessage(componentName, missingRequirements, installNames));
        this.componentName = componentName;
        this.missingRequirements = Set.copyOf(missingRequirements);
        this.installNames = Map.copyOf(installNames);
    }

    public String componentName() {
        return componentName;
    }

    public Set<String> missingRequirements() {
        return missingRequirements;
    }

    public Map<String, List<String>> installNames() {
        return installNames;
    }

    private static String buildMessage(String componentName,
                                       Set<String> missing,
                                       Map<String, List<String>> installNames) {
        StringBuilder message = new StringBuilder()
            .append("Not all required packages are available for component '")
            .append(componentName)
            .append("': ")
            .append(String.join(", ", missing));
        if (!installNames.isEmpty()) {
            message.append(". Add the following to the class path: ")
                .append(installNames.values().stream()
                    .flatMap(List::stream)
                    .distinct()
                    .collect(Collectors.joining(", ")));
        }
        return message.toString();
    }
}
