package com.defold.prefab;

import com.defold.prefab.metadata.ModuleMetadataV1;
import com.defold.prefab.metadata.PlatformSpecificModuleMetadataV1;
import com.defold.prefab.metadata.SchemaMigrations;
import com.defold.prefab.platform.LibraryUsability;
import com.defold.prefab.platform.PlatformFactory;
import com.defold.prefab.platform.PlatformIdentity;
import com.defold.prefab.platform.PlatformRegistry;
import org.apache.commons.io.comparator.NameFileComparator;
import org.apache.commons.io.filefilter.DirectoryFileFilter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileFilter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A named library of a {@link Package} together with every prebuilt variant of it.
 *
 * A module without any prebuilt variants is header only.
 */
public class Module {
    private static final Logger LOGGER = LoggerFactory.getLogger(Module.class);

    private final Path path;
    private final Package pkg;
    private final ModuleMetadataV1 metadata;
    private final String name;
    private final String canonicalName;
    private final Path includePath;
    private final List<LibraryVariant> libraries;

    /**
     * Loads a module and all of its libraries.
     *
     * @param path          The module directory, {@code <package>/modules/<name>}
     * @param pkg           The package owning the module
     * @param schemaVersion The schema version of the package
     */
    public Module(Path path, Package pkg, SchemaVersion schemaVersion) throws PrefabException {
        this.path = path;
        this.pkg = pkg;
        this.name = path.getFileName().toString();
        this.canonicalName = String.format("//%s/%s", pkg.getName(), name);
        this.includePath = path.resolve("include");
        this.metadata = SchemaMigrations.MODULE.loadAndMigrate(schemaVersion, path, null);
        this.libraries = Collections.unmodifiableList(loadLibraries(schemaVersion));
        LOGGER.debug("Loaded module {} with {} libraries", canonicalName, libraries.size());
    }

    private List<LibraryVariant> loadLibraries(SchemaVersion schemaVersion) throws PrefabException {
        File[] directories = path.resolve("libs").toFile().listFiles((FileFilter) DirectoryFileFilter.DIRECTORY);
        if (directories == null) {
            return new ArrayList<>();
        }
        Arrays.sort(directories, NameFileComparator.NAME_COMPARATOR);

        List<LibraryVariant> result = new ArrayList<>();
        for (File directory : directories) {
            Path libraryDirectory = directory.toPath();
            String basename = directory.getName();
            if (!basename.contains(".")) {
                throw InvalidLibraryDirectoryException.invalidName(this, libraryDirectory);
            }
            String platformName = StringUtils.substringBefore(basename, ".");
            String artifactName = StringUtils.substringAfter(basename, ".");
            if (platformName.isEmpty()) {
                throw InvalidLibraryDirectoryException.missingPlatformId(this, libraryDirectory);
            }
            if (artifactName.isEmpty()) {
                throw InvalidLibraryDirectoryException.missingArtifactId(this, libraryDirectory);
            }
            PlatformFactory factory = PlatformRegistry.find(platformName);
            if (factory == null) {
                throw new UnsupportedPlatformException(this, platformName);
            }
            result.add(factory.libraryFromDirectory(libraryDirectory, this, schemaVersion));
        }
        return result;
    }

    public Path getPath() {
        return path;
    }

    public Package getPackage() {
        return pkg;
    }

    public String getName() {
        return name;
    }

    /**
     * @return The name of the module qualified by its package, {@code //<package>/<module>}
     */
    public String getCanonicalName() {
        return canonicalName;
    }

    public Path getIncludePath() {
        return includePath;
    }

    public List<LibraryVariant> getLibraries() {
        return libraries;
    }

    public boolean isHeaderOnly() {
        return libraries.isEmpty();
    }

    /**
     * Finds the best library of this module for the requirement.
     *
     * Header only modules have no libraries to resolve; check {@link #isHeaderOnly()} first.
     *
     * @param requirement The user's target platform
     * @return The best compatible library
     * @throws NoMatchingLibraryException No library is compatible. Carries the reason every library was rejected
     * @throws MalformedModuleException   The compatible libraries cannot be narrowed to a single one
     */
    public LibraryVariant resolveLibrary(PlatformIdentity requirement) throws PrefabException {
        List<LibraryVariant> compatible = new ArrayList<>();
        Map<LibraryVariant, String> rejections = new LinkedHashMap<>();
        for (LibraryVariant library : libraries) {
            LibraryUsability usability = requirement.checkIfUsable(library);
            if (usability.isCompatible()) {
                compatible.add(library);
            } else {
                String reason = ((LibraryUsability.IncompatibleLibrary) usability).getReason();
                LOGGER.debug("Rejected {} for {}: {}", library.getDirectory(), requirement, reason);
                rejections.put(library, reason);
            }
        }

        if (compatible.isEmpty()) {
            Comparator<LibraryVariant> byDirectoryName = Comparator.comparing(l -> l.getDirectory().getFileName().toString());
            Map<LibraryVariant, String> sorted = rejections.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey(byDirectoryName))
                    .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
            throw new NoMatchingLibraryException(this, sorted);
        }
        return requirement.findBestMatch(compatible);
    }

    /**
     * @return The libraries exported to users of this module on the platform
     * @throws IllegalArgumentException An export is a malformed library reference
     */
    public List<LibraryReference> getExportLibraries(PlatformFactory platform) {
        PlatformSpecificModuleMetadataV1 overrides = metadata.getOverrides(platform.getIdentifier());
        List<String> exports = overrides.getExportLibraries() != null
                ? overrides.getExportLibraries()
                : metadata.getExportLibraries();
        return exports.stream().map(LibraryReference::parse).collect(Collectors.toList());
    }

    /**
     * @return The library file name without extension on the platform, {@code lib<module>} unless overridden
     */
    public String getLibraryName(PlatformFactory platform) {
        PlatformSpecificModuleMetadataV1 overrides = metadata.getOverrides(platform.getIdentifier());
        if (overrides.getLibraryName() != null) {
            return overrides.getLibraryName();
        }
        if (metadata.getLibraryName() != null) {
            return metadata.getLibraryName();
        }
        return "lib" + name;
    }

    @Override
    public String toString() {
        return canonicalName;
    }
}
