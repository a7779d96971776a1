package com.defold.prefab;

import java.nio.file.Path;

/**
 * A metadata file could not be read or does not match its schema.
 */
public class InvalidMetadataException extends PrefabException {
    private final Path file;

    public InvalidMetadataException(Path file, String message) {
        super(String.format("%s: %s", file, message));
        this.file = file;
    }

    public InvalidMetadataException(Path file, Throwable cause) {
        super(String.format("%s: %s", file, cause.getMessage()), cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
