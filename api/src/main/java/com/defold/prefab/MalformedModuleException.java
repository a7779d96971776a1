package com.defold.prefab;

/**
 * The module's set of libraries cannot be resolved to a single library. This is a problem with the package
 * itself rather than with the user's requirements.
 */
public class MalformedModuleException extends PrefabException {
    private final Module module;

    public MalformedModuleException(Module module, String message) {
        super(message);
        this.module = module;
    }

    public Module getModule() {
        return module;
    }
}
