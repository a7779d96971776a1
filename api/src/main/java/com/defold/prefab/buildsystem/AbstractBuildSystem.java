package com.defold.prefab.buildsystem;

import com.defold.prefab.LibraryReferenceResolver;
import com.defold.prefab.Module;
import com.defold.prefab.NoMatchingLibraryException;
import com.defold.prefab.Package;
import com.defold.prefab.PrefabException;
import com.defold.prefab.platform.PlatformIdentity;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Common behaviour of the build system plugins.
 */
public abstract class AbstractBuildSystem implements BuildSystem {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractBuildSystem.class);

    protected final Path outputDirectory;
    protected final List<Package> packages;
    protected final LibraryReferenceResolver referenceResolver;

    protected AbstractBuildSystem(Path outputDirectory, List<Package> packages) {
        this.outputDirectory = outputDirectory;
        List<Package> sorted = new ArrayList<>(packages);
        sorted.sort(Comparator.comparing(Package::getName));
        this.packages = Collections.unmodifiableList(sorted);
        this.referenceResolver = new LibraryReferenceResolver(packages);
    }

    /**
     * Deletes any previous output and recreates an empty output directory.
     */
    protected void prepareOutputDirectory() throws IOException {
        File directory = outputDirectory.toFile();
        if (directory.exists()) {
            FileUtils.deleteDirectory(directory);
        }
        FileUtils.forceMkdir(directory);
    }

    /**
     * Renders the text of one module for one requirement.
     */
    @FunctionalInterface
    protected interface ModuleEmitter {
        String emit(Module module, PlatformIdentity requirement) throws PrefabException;
    }

    /**
     * Emits a module, or logs and skips it if the module (or a module it exports) has no library usable for the
     * requirement. Every other failure is propagated.
     *
     * @return The rendered text, empty if the module was skipped
     */
    protected String emitOrSkip(Module module, PlatformIdentity requirement, ModuleEmitter emitter) throws PrefabException {
        try {
            return emitter.emit(module, requirement);
        } catch (NoMatchingLibraryException e) {
            LOGGER.warn("Skipping {} for {}: {}", module.getCanonicalName(), requirement, e.getMessage());
            return "";
        }
    }

    /**
     * @return The path with / separators regardless of the host
     */
    protected static String toSlashPath(Path path) {
        return path.toAbsolutePath().toString().replace(File.separatorChar, '/');
    }
}
