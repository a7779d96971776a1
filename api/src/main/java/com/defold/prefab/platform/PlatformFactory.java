package com.defold.prefab.platform;

import com.defold.prefab.LibraryVariant;
import com.defold.prefab.Module;
import com.defold.prefab.PrefabException;
import com.defold.prefab.SchemaVersion;

import java.nio.file.Path;

/**
 * Loads the libraries of one platform from a module's {@code libs} directory.
 */
public interface PlatformFactory {

    /**
     * @return The platform ID used as the prefix of library directory names, e.g. "android"
     */
    String getIdentifier();

    /**
     * Loads the library found in a single library directory.
     *
     * @param directory     The library directory, e.g. {@code libs/android.arm64-v8a}
     * @param module        The module owning the directory
     * @param schemaVersion The schema version of the package
     */
    LibraryVariant libraryFromDirectory(Path directory, Module module, SchemaVersion schemaVersion)
            throws PrefabException;

    /**
     * @return The library file name without extension for the module on this platform
     */
    default String libraryNameFor(Module module) {
        return module.getLibraryName(this);
    }
}
