package com.defold.prefab;

public class UnsupportedPlatformException extends PrefabException {
    private static final String ERROR_MESSAGE = "%s contains artifacts for an unsupported platform \"%s\"";

    public UnsupportedPlatformException(Module module, String platformName) {
        super(String.format(ERROR_MESSAGE, module.getCanonicalName(), platformName));
    }
}
