package com.di.plumeflux.orchestrator;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Moves orphaned and incomplete files out of the watch root into {@code <archive>/<reason>/},
 * keeping their path relative to the watch root. Disabled unless the station config asks for it;
 * the ledger record alone is enough to keep them from being processed again.
 */
@Slf4j
public class FileArchiver {

    private final Path watchRoot;
    private final Path archiveDir;
    private final boolean enabled;

    public FileArchiver(Path watchRoot, Path archiveDir, boolean enabled) {
        this.watchRoot = watchRoot;
        this.archiveDir = archiveDir;
        this.enabled = enabled && archiveDir != null;
    }

    /** Returns where the file ended up. */
    public Path archive(Path file, String reason) {
        if (!enabled) {
            return file;
        }
        Path relative = watchRoot != null && file.startsWith(watchRoot)
                ? watchRoot.relativize(file) : file.getFileName();
        Path target = archiveDir.resolve(reason).resolve(relative);
        try {
            Files.createDirectories(target.getParent());
            Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("[ARCHIVE] {} -> {}", file.getFileName(), target);
            return target;
        } catch (IOException e) {
            log.warn("[ARCHIVE] could not move {} to {}: {}", file, target, e.getMessage());
            return file;
        }
    }
}
