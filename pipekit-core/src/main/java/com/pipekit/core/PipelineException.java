package com.pipekit.core;

/**
 * Base type for every error raised while resolving, building or running a pipeline.
 *
 * <p>All subclasses describe configuration errors or contract violations. They are
 * fatal to the current build or request and are never retried by the runtime.
 *
 * @since 1.0.0
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
