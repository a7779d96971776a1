package com.defold.prefab.cli;

import com.defold.prefab.Package;
import com.defold.prefab.PrefabException;

public class UnknownDependencyException extends PrefabException {
    private static final String ERROR_MESSAGE = "%s depends on unknown dependency %s";

    public UnknownDependencyException(Package pkg, String dependency) {
        super(String.format(ERROR_MESSAGE, pkg.getName(), dependency));
    }
}
