package com.defold.prefab.cli;

import com.defold.prefab.Package;
import com.defold.prefab.PrefabException;

public class DuplicatePackageException extends PrefabException {
    private static final String ERROR_MESSAGE = "Multiple packages named %s found: %s and %s.";

    public DuplicatePackageException(Package a, Package b) {
        super(String.format(ERROR_MESSAGE, a.getName(), a.getPath(), b.getPath()));
    }
}
