package com.defold.prefab.metadata;

import com.defold.prefab.PrefabException;

import java.nio.file.Path;

/**
 * A metadata record of one schema version that knows how to convert itself to the current record type.
 *
 * @param <C> The current record type
 * @param <D> Additional data some old versions need to migrate, e.g. the owning module
 */
public interface MigratableMetadata<C extends Metadata, D> extends Metadata {

    /**
     * Migrates this record to the current version. The current version returns itself.
     *
     * @param context   The additional migration data
     * @param directory The directory the record was loaded from
     */
    C migrate(D context, Path directory) throws PrefabException;
}
