package com.pipekit.core.resolve;

import com.pipekit.core.PipelineException;

import java.util.List;

/**
 * Raised when declared parameters can be satisfied neither from the context nor from
 * the configuration.
 *
 * <p>The message and {@link #missingNames()} list exactly the unsatisfiable names, in
 * declaration order. Satisfiable names never appear.
 */
public class MissingArgumentException extends PipelineException {

    private final List<String> missingNames;

    public MissingArgumentException(List<String> missingNames) {
        super("Failed to fill arguments, missing: " + String.join(", ", missingNames));
        this.missingNames = List.copyOf(missingNames);
    }

    /**
     * Creates the exception with the place the arguments were needed.
     *
     * @param missingNames unsatisfiable parameter names
     * @param location where the arguments were needed (e.g., component and stage)
     */
    public MissingArgumentException(List<String> missingNames, String location) {
        super("Failed to fill arguments for " + location + ", missing: " + String.join(", ", missingNames));
        this.missingNames = List.copyOf(missingNames);
    }

    public List<String> missingNames() {
        return missingNames;
    }
}
