package com.cmakeparser.interpreter;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Backs the {@code EXISTS} condition. Embedding applications can supply their own
 * check, for instance one that resolves paths against a virtual source tree.
 */
@FunctionalInterface
public interface ExistenceCheck {

    boolean exists(String path);

    /**
     * Checks the local file system. Strings that are not valid paths do not exist.
     */
    static ExistenceCheck fileSystem() {
        return path -> {
            try {
                return Files.exists(Path.of(path));
            } catch (InvalidPathException e) {
                return false;
            }
        };
    }
}
