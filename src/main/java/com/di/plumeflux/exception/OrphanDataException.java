package com.di.plumeflux.exception;

import java.nio.file.Path;

/**
 * An image that cannot be paired because a closer candidate already took its place in the window.
 * Logged and archived, never failed.
 */
public class OrphanDataException extends PipelineException {

    private final Path path;

    public OrphanDataException(Path path, String reason) {
        super("Orphaned " + path.getFileName() + ": " + reason);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
