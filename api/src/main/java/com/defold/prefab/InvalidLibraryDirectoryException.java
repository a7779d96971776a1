package com.defold.prefab;

import java.nio.file.Path;

/**
 * A library directory of a module is not named {@code <platform ID>.<artifact ID>}.
 */
public class InvalidLibraryDirectoryException extends PrefabException {
    private static final String ERROR_MESSAGE = "%s artifact directory %s %s. It should have the name format <platform ID>.<artifact ID> e.g. android.x86";

    private InvalidLibraryDirectoryException(Module module, Path directory, String problem) {
        super(String.format(ERROR_MESSAGE, module.getCanonicalName(), directory, problem));
    }

    public static InvalidLibraryDirectoryException invalidName(Module module, Path directory) {
        return new InvalidLibraryDirectoryException(module, directory, "has an invalid name");
    }

    public static InvalidLibraryDirectoryException missingPlatformId(Module module, Path directory) {
        return new InvalidLibraryDirectoryException(module, directory, "does not contain a platform ID");
    }

    public static InvalidLibraryDirectoryException missingArtifactId(Module module, Path directory) {
        return new InvalidLibraryDirectoryException(module, directory, "is missing an artifact ID");
    }
}
