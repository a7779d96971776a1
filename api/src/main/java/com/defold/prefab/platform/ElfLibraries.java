package com.defold.prefab.platform;

import com.defold.prefab.PrefabException;
import org.apache.commons.io.FilenameUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Locates the ELF library of a library directory.
 */
public final class ElfLibraries {
    public static final String STATIC_EXTENSION = "a";
    public static final String SHARED_EXTENSION = "so";

    private ElfLibraries() {
    }

    /**
     * @param directory The library directory
     * @param name      The library name without extension, e.g. libfoo
     * @return The path to the only {@code name.a} or {@code name.so} in the directory
     * @throws PrefabException Neither or both exist
     */
    public static Path find(Path directory, String name) throws PrefabException {
        List<Path> found = new ArrayList<>();
        for (String extension : new String[]{STATIC_EXTENSION, SHARED_EXTENSION}) {
            Path candidate = directory.resolve(name + "." + extension);
            if (Files.exists(candidate)) {
                found.add(candidate);
            }
        }
        if (found.size() > 1) {
            throw new PrefabException(String.format("Prebuilt directory contains multiple library artifacts: %s", directory));
        }
        if (found.isEmpty()) {
            throw new PrefabException(String.format("Prebuilt directory contains no library artifacts: %s", directory));
        }
        return found.get(0);
    }

    public static boolean isStaticArchive(Path library) {
        return FilenameUtils.isExtension(library.getFileName().toString(), STATIC_EXTENSION);
    }

    /**
     * @return The path the library of a directory has when its kind is already known
     */
    public static Path libraryPath(Path directory, String name, boolean isStatic) {
        return directory.resolve(name + "." + (isStatic ? STATIC_EXTENSION : SHARED_EXTENSION));
    }
}
