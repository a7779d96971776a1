package com.defold.prefab;

/**
 * The module ships one library per toolchain version but has a gap where the requested version should be.
 */
public class MissingToolchainVariantException extends MalformedModuleException {
    private static final String ERROR_MESSAGE = "%s contains a library per NDK version but no match was found for %d";

    private final int toolchainVersion;

    public MissingToolchainVariantException(Module module, int toolchainVersion) {
        super(module, String.format(ERROR_MESSAGE, module.getCanonicalName(), toolchainVersion));
        this.toolchainVersion = toolchainVersion;
    }

    public int getToolchainVersion() {
        return toolchainVersion;
    }
}
