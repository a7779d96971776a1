package com.defold.prefab.metadata;

import com.defold.prefab.Module;
import com.defold.prefab.SchemaVersion;

/**
 * The loaders of every metadata file, keyed by schema version.
 */
public final class SchemaMigrations {

    public static final MetadataLoader<PackageMetadataV1, Void> PACKAGE =
            MetadataLoader.<PackageMetadataV1, Void>builder(SchemaVersion.PACKAGE_METADATA_FILE)
                    .version(SchemaVersion.V1, PackageMetadataV1.class)
                    .version(SchemaVersion.V2, PackageMetadataV1.class)
                    .build();

    public static final MetadataLoader<ModuleMetadataV1, Void> MODULE =
            MetadataLoader.<ModuleMetadataV1, Void>builder("module.json")
                    .version(SchemaVersion.V1, ModuleMetadataV1.class)
                    .version(SchemaVersion.V2, ModuleMetadataV1.class)
                    .build();

    public static final MetadataLoader<AndroidAbiMetadataV2, Module> ANDROID_ABI =
            MetadataLoader.<AndroidAbiMetadataV2, Module>builder("abi.json")
                    .version(SchemaVersion.V1, AndroidAbiMetadataV1.class)
                    .version(SchemaVersion.V2, AndroidAbiMetadataV2.class)
                    .build();

    public static final MetadataLoader<GnuLinuxAbiMetadataV1, Module> GNU_LINUX_ABI =
            MetadataLoader.<GnuLinuxAbiMetadataV1, Module>builder("abi.json")
                    .version(SchemaVersion.V1, GnuLinuxAbiMetadataV1.class)
                    .version(SchemaVersion.V2, GnuLinuxAbiMetadataV1.class)
                    .build();

    private SchemaMigrations() {
    }
}
