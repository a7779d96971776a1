package com.defold.prefab.metadata;

import com.defold.prefab.PrefabException;
import com.defold.prefab.SchemaVersion;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Loads one kind of metadata file and migrates it to the current record type.
 *
 * Holds the table from schema version to the record class stored on disk for that version. Tables are built once
 * and must cover every {@link SchemaVersion}.
 *
 * @param <C> The current record type
 * @param <D> Additional data needed to migrate old versions
 */
public final class MetadataLoader<C extends Metadata, D> {
    private final String fileName;
    private final Map<SchemaVersion, Class<? extends MigratableMetadata<C, D>>> recordTypes;

    private MetadataLoader(String fileName, Map<SchemaVersion, Class<? extends MigratableMetadata<C, D>>> recordTypes) {
        this.fileName = fileName;
        this.recordTypes = Collections.unmodifiableMap(new EnumMap<>(recordTypes));
    }

    public static <C extends Metadata, D> Builder<C, D> builder(String fileName) {
        return new Builder<>(fileName);
    }

    public String getFileName() {
        return fileName;
    }

    public Class<? extends MigratableMetadata<C, D>> metadataClassFor(SchemaVersion schemaVersion) {
        return recordTypes.get(schemaVersion);
    }

    /**
     * Loads the record exactly as stored for the given schema version.
     */
    public MigratableMetadata<C, D> load(SchemaVersion schemaVersion, Path directory) throws PrefabException {
        return JsonMetadataReader.read(directory.resolve(fileName), metadataClassFor(schemaVersion));
    }

    /**
     * Loads the record and migrates it to the current version if needed.
     *
     * @param schemaVersion The schema version of the package
     * @param directory     The directory holding the metadata file
     * @param context       The additional data needed to migrate old versions
     */
    public C loadAndMigrate(SchemaVersion schemaVersion, Path directory, D context) throws PrefabException {
        return load(schemaVersion, directory).migrate(context, directory);
    }

    public static final class Builder<C extends Metadata, D> {
        private final String fileName;
        private final Map<SchemaVersion, Class<? extends MigratableMetadata<C, D>>> recordTypes = new EnumMap<>(SchemaVersion.class);

        private Builder(String fileName) {
            this.fileName = fileName;
        }

        public Builder<C, D> version(SchemaVersion schemaVersion, Class<? extends MigratableMetadata<C, D>> recordType) {
            if (recordTypes.containsKey(schemaVersion)) {
                throw new IllegalArgumentException(String.format("%s already has a record type for %s", fileName, schemaVersion));
            }
            recordTypes.put(schemaVersion, recordType);
            return this;
        }

        public MetadataLoader<C, D> build() {
            for (SchemaVersion schemaVersion : SchemaVersion.values()) {
                if (!recordTypes.containsKey(schemaVersion)) {
                    throw new IllegalStateException(String.format("%s has no record type for %s", fileName, schemaVersion));
                }
            }
            return new MetadataLoader<>(fileName, recordTypes);
        }
    }
}
