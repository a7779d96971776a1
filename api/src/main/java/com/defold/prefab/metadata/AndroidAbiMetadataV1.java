package com.defold.prefab.metadata;

import com.defold.prefab.Module;
import com.defold.prefab.PrefabException;
import com.defold.prefab.platform.Android;
import com.defold.prefab.platform.ElfLibraries;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * The V1 Android abi.json record.
 */
public final class AndroidAbiMetadataV1 implements MigratableMetadata<AndroidAbiMetadataV2, Module> {
    private static final Logger LOGGER = LoggerFactory.getLogger(AndroidAbiMetadataV1.class);

    private final String abi;
    private final int api;
    private final int ndk;
    private final String stl;

    /**
     * @param abi The ABI name of the library, see {@link Android.Abi}
     * @param api The minSdkVersion the library was built for
     * @param ndk The major version of the NDK the library was built with
     * @param stl The STL the library was built with, see {@link Android.Stl}
     */
    @JsonCreator
    public AndroidAbiMetadataV1(@JsonProperty(value = "abi", required = true) String abi,
                                @JsonProperty(value = "api", required = true) int api,
                                @JsonProperty(value = "ndk", required = true) int ndk,
                                @JsonProperty(value = "stl", required = true) String stl) {
        this.abi = abi;
        this.api = api;
        this.ndk = ndk;
        this.stl = stl;
    }

    /**
     * The library kind is not recorded in V1, so it is taken from the library file in the directory.
     */
    @Override
    public AndroidAbiMetadataV2 migrate(Module module, Path directory) throws PrefabException {
        Path library = ElfLibraries.find(directory, Android.FACTORY.libraryNameFor(module));
        boolean isStatic = ElfLibraries.isStaticArchive(library);
        LOGGER.debug("Migrating {} to schema V2, static={}", directory, isStatic);
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
}
