package com.defold.prefab.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * The module.json values that a platform may override. Null means not overridden.
 */
public final class PlatformSpecificModuleMetadataV1 {
    public static final PlatformSpecificModuleMetadataV1 EMPTY = new PlatformSpecificModuleMetadataV1(null, null);

    private final List<String> exportLibraries;
    private final String libraryName;

    @JsonCreator
    public PlatformSpecificModuleMetadataV1(@JsonProperty("export_libraries") List<String> exportLibraries,
                                            @JsonProperty("library_name") String libraryName) {
        this.exportLibraries = exportLibraries != null ? Collections.unmodifiableList(exportLibraries) : null;
        this.libraryName = libraryName;
    }

    public List<String> getExportLibraries() {
        return exportLibraries;
    }

    public String getLibraryName() {
        return libraryName;
    }
}
