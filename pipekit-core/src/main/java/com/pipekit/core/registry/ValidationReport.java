package com.pipekit.core.registry;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a validation pass.
 *
 * @param errors one message per problem found, empty when valid
 */
public record ValidationReport(List<String> errors) {

    public ValidationReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Combines this report with another.
     *
     * @param other report to append
     * @return report holding both error lists
     */
    public ValidationReport merge(ValidationReport other) {
        List<String> merged = new ArrayList<>(errors);
        merged.addAll(other.errors());
        return new ValidationReport(merged);
    }
}
