package com.defold.prefab.cli.ndkbuild;

import com.defold.prefab.Package;
import com.defold.prefab.buildsystem.BuildSystem;
import com.defold.prefab.buildsystem.BuildSystemProvider;

import java.nio.file.Path;
import java.util.List;

public class NdkBuildSystemProvider implements BuildSystemProvider {
    public static final String IDENTIFIER = "ndk-build";

    @Override
    public String getIdentifier() {
        return IDENTIFIER;
    }

    @Override
    public BuildSystem create(Path outputDirectory, List<Package> packages) {
        return new NdkBuildSystem(outputDirectory, packages);
    }
}
