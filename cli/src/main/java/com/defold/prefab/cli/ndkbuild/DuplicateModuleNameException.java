package com.defold.prefab.cli.ndkbuild;

import com.defold.prefab.Module;
import com.defold.prefab.PrefabException;

/**
 * ndk-build module names are global, so two packages may not contain modules of the same name.
 */
public class DuplicateModuleNameException extends PrefabException {
    private static final String ERROR_MESSAGE = "Duplicate module name found (%s and %s). ndk-build does not support fully qualified module names.";

    public DuplicateModuleNameException(Module a, Module b) {
        super(String.format(ERROR_MESSAGE, a.getCanonicalName(), b.getCanonicalName()));
    }
}
