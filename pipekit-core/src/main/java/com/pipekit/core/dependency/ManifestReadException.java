package com.pipekit.core.dependency;

import com.pipekit.core.PipelineException;

import java.nio.file.Path;

/**
 * Raised when a requirements manifest is missing, unreadable or malformed.
 */
public class ManifestReadException extends PipelineException {

    private final Path path;

    public ManifestReadException(Path path, String reason) {
        super("Failed to read requirements manifest " + path + ": " + reason);
        this.path = path;
    }

    public ManifestReadException(Path path, String reason, Throwable cause) {
        super("Failed to read requirements manifest " + path + ": " + reason, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
