package com.di.plumeflux.observer;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The acquisition software holds a lock file next to a data file while writing it. Both the
 * extension-replacing form ({@code scan_x.lock}) and the appended form ({@code scan_x.npy.lock})
 * are recognized.
 */
public final class LockFiles {

    private LockFiles() {
    }

    public static boolean isLocked(Path file, String lockSuffix) {
        String name = file.getFileName().toString();
        if (Files.exists(file.resolveSibling(name + lockSuffix))) {
            return true;
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 && Files.exists(file.resolveSibling(name.substring(0, dot) + lockSuffix));
    }
}
