package com.di.plumeflux.observer;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A classified, stable acquisition file. Immutable once classified; the pipeline treats the file
 * itself as read-only evidence.
 */
@Value
@Builder
public class RawFile {

    Path path;
    FileKind kind;
    /** Acquisition time parsed from the filename. */
    Instant acquiredAt;
    long size;
    Instant lastModified;

    public String fileName() {
        return path.getFileName().toString();
    }
}
