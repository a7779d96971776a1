package com.defold.prefab;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * More than one library of the module is an equally good match and nothing distinguishes them.
 */
public class RedundantLibrariesException extends MalformedModuleException {
    private final List<LibraryVariant> libraries;

    public RedundantLibrariesException(Module module, List<LibraryVariant> libraries) {
        super(module, String.format("Unable to resolve a single library match for %s. The following libraries are redundant:\n%s",
                module.getCanonicalName(),
                libraries.stream().map(l -> l.getDirectory().toString()).collect(Collectors.joining("\n"))));
        this.libraries = Collections.unmodifiableList(libraries);
    }

    public List<LibraryVariant> getLibraries() {
        return libraries;
    }
}
