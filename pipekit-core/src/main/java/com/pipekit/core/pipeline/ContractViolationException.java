package com.pipekit.core.pipeline;

import com.pipekit.core.PipelineException;
import com.pipekit.core.component.LifecycleStage;

import java.util.List;

/**
 * Raised when a component does not provide a context key it declared for a stage.
 *
 * <p>Signals a defect in the component. The runtime never substitutes defaults.
 */
public class ContractViolationException extends PipelineException {

    private final String componentName;
    private final LifecycleStage stage;
    private final List<String> missingKeys;

    public ContractViolationException(String componentName, LifecycleStage stage, List<String> missingKeys) {
        super("Component '" + componentName + "' did not provide declared " + stage.id()
            + " context keys: " + String.join(", ", missingKeys));
        this.componentName = componentName;
        this.stage = stage;
        this.missingKeys = List.copyOf(missingKeys);
    }

    public String componentName() {
        return componentName;
    }

    public LifecycleStage stage() {
        return stage;
    }

    public List<String> missingKeys() {
        return missingKeys;
    }
}
