package com.defold.prefab;

import com.defold.prefab.metadata.PackageMetadataV1;
import com.defold.prefab.metadata.SchemaMigrations;
import org.apache.commons.io.comparator.NameFileComparator;
import org.apache.commons.io.filefilter.DirectoryFileFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileFilter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A package of native modules as laid out on disk.
 *
 * <pre>
 * prefab.json
 * modules/&lt;module&gt;/module.json
 * modules/&lt;module&gt;/include/
 * modules/&lt;module&gt;/libs/&lt;platform&gt;.&lt;artifact&gt;/
 * </pre>
 */
public class Package {
    private static final Logger LOGGER = LoggerFactory.getLogger(Package.class);

    // CMake's package version format.
    private static final Pattern VERSION_PATTERN = Pattern.compile("\\d+(\\.\\d+){0,3}");

    private final Path path;
    private final SchemaVersion schemaVersion;
    private final PackageMetadataV1 metadata;
    private final List<Module> modules;

    /**
     * Loads the package and all of its modules.
     *
     * @param path The package root
     */
    public Package(Path path) throws PrefabException {
        this.path = path;
        this.schemaVersion = SchemaVersion.fromPackageDirectory(path);
        this.metadata = SchemaMigrations.PACKAGE.loadAndMigrate(schemaVersion, path, null);
        if (metadata.getVersion() != null && !VERSION_PATTERN.matcher(metadata.getVersion()).matches()) {
            throw new InvalidMetadataException(path.resolve(SchemaVersion.PACKAGE_METADATA_FILE), String.format(
                    "version must be compatible with CMake, if present. Found \"%s\"", metadata.getVersion()));
        }
        LOGGER.debug("Loading package {} (schema version {}) from {}", metadata.getName(), schemaVersion.getVersion(), path);
        this.modules = Collections.unmodifiableList(loadModules());
    }

    private List<Module> loadModules() throws PrefabException {
        File moduleDirectory = path.resolve("modules").toFile();
        File[] directories = moduleDirectory.listFiles((FileFilter) DirectoryFileFilter.DIRECTORY);
        if (directories == null) {
            throw new PrefabException(String.format("Unable to retrieve file list for %s", moduleDirectory));
        }
        Arrays.sort(directories, NameFileComparator.NAME_COMPARATOR);

        List<Module> result = new ArrayList<>();
        for (File directory : directories) {
            result.add(new Module(directory.toPath(), this, schemaVersion));
        }
        return result;
    }

    public Path getPath() {
        return path;
    }

    public SchemaVersion getSchemaVersion() {
        return schemaVersion;
    }

    public String getName() {
        return metadata.getName();
    }

    public List<String> getDependencies() {
        return metadata.getDependencies();
    }

    /**
     * @return The package version, or null if the package does not declare one
     */
    public String getVersion() {
        return metadata.getVersion();
    }

    public List<Module> getModules() {
        return modules;
    }

    /**
     * @return The module with the given name, or null if the package has none
     */
    public Module findModule(String name) {
        for (Module module : modules) {
            if (module.getName().equals(name)) {
                return module;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return getName();
    }
}
