package com.defold.prefab;

public class UnsupportedSchemaVersionException extends PrefabException {
    private static final String ERROR_MESSAGE = "schema_version must be between %d and %d. Package uses version %d.";

    private final int version;

    public UnsupportedSchemaVersionException(int version, int oldest, int latest) {
        super(String.format(ERROR_MESSAGE, oldest, latest, version));
        this.version = version;
    }

    public int getVersion() {
        return version;
    }
}
