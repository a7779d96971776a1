package com.defold.prefab.metadata;

import com.defold.prefab.Module;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;

/**
 * The V2 Android abi.json record.
 *
 * Adds {@code static}. V1 packages had to be inspected for a .a or .so to know this, which meant they could not
 * be processed until the libraries were built.
 */
public final class AndroidAbiMetadataV2 implements MigratableMetadata<AndroidAbiMetadataV2, Module> {
    private final String abi;
    private final int api;
    private final int ndk;
    private final String stl;
    private final boolean isStatic;

    @JsonCreator
    public AndroidAbiMetadataV2(@JsonProperty(value = "abi", required = true) String abi,
                                @JsonProperty(value = "api", required = true) int api,
                                @JsonProperty(value = "ndk", required = true) int ndk,
                                @JsonProperty(value = "stl", required = true) String stl,
                                @JsonProperty("static") Boolean isStatic) {
        this.abi = abi;
        this.api = api;
        this.ndk = ndk;
        this.stl = stl;
        this.isStatic = isStatic != null && isStatic;
    }

    @Override
    public AndroidAbiMetadataV2 migrate(Module module, Path directory) {
        return new AndroidAbiMetadataV2(abi, api, ndk, stl, isStatic);
    }

    public String getAbi() {
        return abi;
    }

    public int getApi() {
        return api;
    }

    public int getNdk() {
        return ndk;
    }

    public String getStl() {
        return stl;
    }

    public boolean isStatic() {
        return isStatic;
    }
}
