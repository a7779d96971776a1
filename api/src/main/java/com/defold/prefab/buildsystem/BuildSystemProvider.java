package com.defold.prefab.buildsystem;

import com.defold.prefab.Package;

import java.nio.file.Path;
import java.util.List;

/**
 * Creates a {@link BuildSystem}. Implementations are registered as {@code java.util.ServiceLoader} services.
 */
public interface BuildSystemProvider {

    /**
     * @return The name the build system is selected by on the command line, e.g. "cmake"
     */
    String getIdentifier();

    /**
     * @param outputDirectory The directory the generated files are written to
     * @param packages        Every package to generate files for
     */
    BuildSystem create(Path outputDirectory, List<Package> packages);
}
