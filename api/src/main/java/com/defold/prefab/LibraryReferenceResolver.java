package com.defold.prefab;

import com.defold.prefab.platform.PlatformIdentity;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves local and external library references against the loaded packages.
 */
public class LibraryReferenceResolver {

    public enum Linkage {
        HEADER_ONLY,
        STATIC,
        SHARED
    }

    private final Map<String, Package> packages = new LinkedHashMap<>();

    public LibraryReferenceResolver(Collection<Package> packages) {
        for (Package pkg : packages) {
            this.packages.put(pkg.getName(), pkg);
        }
    }

    /**
     * @param reference  A local or external reference
     * @param fromModule The module exporting the reference
     * @return The referenced module
     * @throws IllegalArgumentException      The reference is a literal
     * @throws UnresolvedReferenceException No loaded package provides the module
     */
    public Module findModule(LibraryReference reference, Module fromModule) throws UnresolvedReferenceException {
        Module target;
        if (reference instanceof LibraryReference.Local) {
            target = fromModule.getPackage().findModule(((LibraryReference.Local) reference).getName());
        } else if (reference instanceof LibraryReference.External) {
            LibraryReference.External external = (LibraryReference.External) reference;
            Package pkg = packages.get(external.getPackage());
            target = pkg != null ? pkg.findModule(external.getModule()) : null;
        } else {
            throw new IllegalArgumentException(String.format("Literal library reference %s does not refer to a module", reference));
        }
        if (target == null) {
            throw new UnresolvedReferenceException(reference, fromModule);
        }
        return target;
    }

    /**
     * @return How users of the module link it when building for the requirement
     */
    public Linkage linkageOf(Module module, PlatformIdentity requirement) throws PrefabException {
        if (module.isHeaderOnly()) {
            return Linkage.HEADER_ONLY;
        }
        return module.resolveLibrary(requirement).isStatic() ? Linkage.STATIC : Linkage.SHARED;
    }
}
