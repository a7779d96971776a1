package com.defold.prefab;

/**
 * Base type of every failure caused by the packages being processed, as opposed to programming errors.
 */
public class PrefabException extends Exception {

    public PrefabException(String message) {
        super(message);
    }

    public PrefabException(String message, Throwable cause) {
        super(message, cause);
    }
}
