package com.defold.prefab.platform;

import com.defold.prefab.LibraryVariant;
import com.defold.prefab.MalformedModuleException;
import com.defold.prefab.Module;
import org.apache.commons.lang3.Validate;

import java.util.List;

/**
 * A target platform. Describes either the platform a user is building for or the platform a library was built for.
 *
 * Each supported platform is one subclass. Identities of different platforms are never compatible with each other.
 */
public abstract class PlatformIdentity {

    /**
     * @return The factory that loads libraries of this platform
     */
    public abstract PlatformFactory getFactory();

    /**
     * @return The target triple of the platform, e.g. aarch64-linux-android
     */
    public abstract String getTargetTriple();

    /**
     * @return True if this identity describes a static archive
     */
    public abstract boolean isStaticArtifact();

    /**
     * Checks whether a library may be used by a user with the requirements described by this identity.
     *
     * @param library The candidate library
     * @return {@link LibraryUsability.CompatibleLibrary} or the reason the library was rejected
     */
    public abstract LibraryUsability checkIfUsable(LibraryVariant library);

    /**
     * Picks the best library of a module for this requirement.
     *
     * @param libraries The libraries of a single module that passed {@link #checkIfUsable(LibraryVariant)}
     * @return The best match
     * @throws IllegalArgumentException The list is empty, mixes modules or contains an incompatible library
     * @throws MalformedModuleException The module's libraries cannot be narrowed to a single match
     */
    public final LibraryVariant findBestMatch(List<LibraryVariant> libraries) throws MalformedModuleException {
        Validate.notEmpty(libraries, "libraries must be non-empty");
        Module module = libraries.get(0).getModule();
        for (LibraryVariant library : libraries) {
            Validate.isTrue(library.getModule() == module, "all libraries must belong to the same module");
            Validate.isTrue(checkIfUsable(library).isCompatible(), "all libraries must be compatible");
        }
        return selectBestMatch(module, libraries);
    }

    /**
     * Picks the best library once {@link #findBestMatch(List)} has validated the input.
     */
    protected abstract LibraryVariant selectBestMatch(Module module, List<LibraryVariant> libraries)
            throws MalformedModuleException;
}
