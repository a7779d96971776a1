package com.defold.prefab;

import com.defold.prefab.platform.PlatformIdentity;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One prebuilt library of a {@link Module}, built for one platform configuration.
 */
public class LibraryVariant {
    private final Path path;
    private final Module module;
    private final PlatformIdentity platform;
    private final Path includePath;

    /**
     * @param path     The library file
     * @param module   The module owning the library
     * @param platform The platform the library was built for
     */
    public LibraryVariant(Path path, Module module, PlatformIdentity platform) {
        this.path = path;
        this.module = module;
        this.platform = platform;
        Path directoryIncludes = getDirectory().resolve("include");
        this.includePath = Files.exists(directoryIncludes) ? directoryIncludes : module.getIncludePath();
    }

    public Path getPath() {
        return path;
    }

    public Path getDirectory() {
        return path.getParent();
    }

    public Module getModule() {
        return module;
    }

    public PlatformIdentity getPlatform() {
        return platform;
    }

    /**
     * @return The library's own include directory if it has one, otherwise the module's
     */
    public Path getIncludePath() {
        return includePath;
    }

    public boolean isStatic() {
        return platform.isStaticArtifact();
    }

    @Override
    public String toString() {
        return String.format("LibraryVariant(%s, %s)", path, platform);
    }
}
