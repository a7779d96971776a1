package com.defold.prefab;

public class UnresolvedReferenceException extends PrefabException {

    public UnresolvedReferenceException(LibraryReference reference, Module module) {
        super(String.format("Could not find a module matching %s exported by %s", reference, module.getCanonicalName()));
    }
}
