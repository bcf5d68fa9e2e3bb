package com.pipekit.core.builder;

import com.pipekit.core.PipelineException;

import java.util.List;

/**
 * Raised when a requested component name is not registered.
 */
public class UnknownComponentException extends PipelineException {

    private final String componentName;
    private final List<String> suggestions;

    public UnknownComponentException(String componentName, List<String> suggestions) {
        super(buildMessage(componentName, suggestions));
        this.componentName = componentName;
        this.suggestions = List.copyOf(suggestions);
    }

    public String componentName() {
        return componentName;
    }

    /**
     * Returns the closest registered names, best first.
     *
     * @return suggested names, possibly empty
     */
    public List<String> suggestions() {
        return suggestions;
    }

    private static String buildMessage(String componentName, List<String> suggestions) {
        String message = "Unknown component name '" + componentName + "'.";
        if (!suggestions.isEmpty()) {
            message += " Did you mean: " + String.join(", ", suggestions) + "?";
        }
        return message;
    }
}
