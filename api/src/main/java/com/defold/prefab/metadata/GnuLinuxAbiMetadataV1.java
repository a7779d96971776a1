package com.defold.prefab.metadata;

import com.defold.prefab.Module;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;

/**
 * The GNU/Linux abi.json record. Shared by every schema version so far.
 */
public final class GnuLinuxAbiMetadataV1 implements MigratableMetadata<GnuLinuxAbiMetadataV1, Module> {
    private final String arch;
    private final String glibcVersion;

    @JsonCreator
    public GnuLinuxAbiMetadataV1(@JsonProperty(value = "arch", required = true) String arch,
                                 @JsonProperty(value = "glibc_version", required = true) String glibcVersion) {
        this.arch = arch;
        this.glibcVersion = glibcVersion;
    }

    @Override
    public GnuLinuxAbiMetadataV1 migrate(Module module, Path directory) {
        return this;
    }

    public String getArch() {
        return arch;
    }

    public String getGlibcVersion() {
        return glibcVersion;
    }
}
