package com.defold.prefab.metadata;

/**
 * Marker for the on-disk metadata records of every schema version.
 */
public interface Metadata {
}
