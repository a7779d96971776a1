package com.defold.prefab.cli.cmake;

import com.defold.prefab.Package;
import com.defold.prefab.buildsystem.BuildSystem;
import com.defold.prefab.buildsystem.BuildSystemProvider;

import java.nio.file.Path;
import java.util.List;

public class CMakeBuildSystemProvider implements BuildSystemProvider {
    public static final String IDENTIFIER = "cmake";

    @Override
    public String getIdentifier() {
        return IDENTIFIER;
    }

    @Override
    public BuildSystem create(Path outputDirectory, List<Package> packages) {
        return new CMakeBuildSystem(outputDirectory, packages);
    }
}
