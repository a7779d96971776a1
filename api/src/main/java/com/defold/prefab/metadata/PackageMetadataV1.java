package com.defold.prefab.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * The prefab.json record. Shared by every schema version so far.
 */
public final class PackageMetadataV1 implements MigratableMetadata<PackageMetadataV1, Void> {
    private final String name;
    private final int schemaVersion;
    private final List<String> dependencies;
    private final String version;

    /**
     * @param name          The name of the package
     * @param schemaVersion The schema version of the package
     * @param dependencies  The names of the other packages this package requires
     * @param version       The package version. For CMake compatibility this must be
     *                      {@code major[.minor[.patch[.tweak]]]} with numeric components. May be null.
     */
    @JsonCreator
    public PackageMetadataV1(@JsonProperty(value = "name", required = true) String name,
                             @JsonProperty(value = "schema_version", required = true) int schemaVersion,
                             @JsonProperty(value = "dependencies", required = true) List<String> dependencies,
                             @JsonProperty("version") String version) {
        this.name = name;
        this.schemaVersion = schemaVersion;
        this.dependencies = Collections.unmodifiableList(dependencies);
        this.version = version;
    }

    @Override
    public PackageMetadataV1 migrate(Void context, Path directory) {
        return this;
    }

    public String getName() {
        return name;
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public String getVersion() {
        return version;
    }
}
