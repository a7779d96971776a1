package com.defold.prefab.metadata;

import com.defold.prefab.platform.Android;
import com.defold.prefab.platform.GnuLinux;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * The module.json record. Shared by every schema version so far.
 *
 * Per-platform overrides exist from the first version on so that old packages stay unambiguous when platforms are
 * added.
 */
public final class ModuleMetadataV1 implements MigratableMetadata<ModuleMetadataV1, Void> {
    private final List<String> exportLibraries;
    private final String libraryName;
    private final PlatformSpecificModuleMetadataV1 android;
    private final PlatformSpecificModuleMetadataV1 gnulinux;

    @JsonCreator
    public ModuleMetadataV1(@JsonProperty(value = "export_libraries", required = true) List<String> exportLibraries,
                            @JsonProperty("library_name") String libraryName,
                            @JsonProperty("android") PlatformSpecificModuleMetadataV1 android,
                            @JsonProperty("gnulinux") PlatformSpecificModuleMetadataV1 gnulinux) {
        this.exportLibraries = Collections.unmodifiableList(exportLibraries);
        this.libraryName = libraryName;
        this.android = android != null ? android : PlatformSpecificModuleMetadataV1.EMPTY;
        this.gnulinux = gnulinux != null ? gnulinux : PlatformSpecificModuleMetadataV1.EMPTY;
    }

    @Override
    public ModuleMetadataV1 migrate(Void context, Path directory) {
        return this;
    }

    public List<String> getExportLibraries() {
        return exportLibraries;
    }

    public String getLibraryName() {
        return libraryName;
    }

    public PlatformSpecificModuleMetadataV1 getAndroid() {
        return android;
    }

    public PlatformSpecificModuleMetadataV1 getGnulinux() {
        return gnulinux;
    }

    /**
     * @param platformIdentifier The library directory prefix of the platform, e.g. "android"
     * @return The overrides for the platform, empty if the platform has none
     */
    public PlatformSpecificModuleMetadataV1 getOverrides(String platformIdentifier) {
        switch (platformIdentifier) {
            case Android.IDENTIFIER:
                return android;
            case GnuLinux.IDENTIFIER:
                return gnulinux;
            default:
                throw new IllegalArgumentException(String.format("Unrecognized platform: %s", platformIdentifier));
        }
    }
}
