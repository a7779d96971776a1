package com.defold.prefab;

import com.defold.prefab.metadata.JsonMetadataReader;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;

/**
 * The known versions of the on-disk package format.
 *
 * The version is declared once per package, in the {@code schema_version} property of prefab.json, and selects
 * which shape of every metadata file in the package is loaded.
 */
public enum SchemaVersion {
    /**
     * The initial package format.
     */
    V1(1),

    /**
     * Adds the explicit {@code static} property to Android abi.json so that a package can be processed before its
     * libraries have been built.
     */
    V2(2);

    public static final String PACKAGE_METADATA_FILE = "prefab.json";

    private static final SchemaVersion OLDEST = V1;
    private static final SchemaVersion LATEST = V2;

    private final int version;

    SchemaVersion(int version) {
        this.version = version;
    }

    public int getVersion() {
        return version;
    }

    public static SchemaVersion latest() {
        return LATEST;
    }

    /**
     * @param version The integer form of the schema version
     * @return The matching schema version
     * @throws UnsupportedSchemaVersionException No schema version matches
     */
    public static SchemaVersion from(int version) throws UnsupportedSchemaVersionException {
        for (SchemaVersion schemaVersion : values()) {
            if (schemaVersion.version == version) {
                return schemaVersion;
            }
        }
        throw new UnsupportedSchemaVersionException(version, OLDEST.version, LATEST.version);
    }

    /**
     * Reads the schema version of a package. Only {@code schema_version} is looked at since the shape of the rest
     * of prefab.json depends on it.
     *
     * @param packageDirectory The package root
     * @return The schema version the package declares
     */
    public static SchemaVersion fromPackageDirectory(Path packageDirectory) throws PrefabException {
        Path file = packageDirectory.resolve(PACKAGE_METADATA_FILE);
        JsonNode root = JsonMetadataReader.readTree(file);
        JsonNode schemaVersion = root.get("schema_version");
        if (schemaVersion == null || !schemaVersion.isInt()) {
            throw new InvalidMetadataException(file, "schema_version must be an integer");
        }
        return from(schemaVersion.intValue());
    }
}
