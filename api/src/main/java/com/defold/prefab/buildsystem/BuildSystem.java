package com.defold.prefab.buildsystem;

import com.defold.prefab.PrefabException;
import com.defold.prefab.platform.PlatformIdentity;

import java.io.IOException;
import java.util.List;

/**
 * Writes the integration files of one build system for a set of packages.
 */
public interface BuildSystem {

    /**
     * Generates the build system files for the requirements.
     *
     * Modules with no library compatible with a requirement are skipped.
     *
     * @param requirements The platforms the user is building for
     */
    void generate(List<PlatformIdentity> requirements) throws PrefabException, IOException;
}
