package com.defold.prefab.platform;

import com.defold.prefab.InvalidMetadataException;
import com.defold.prefab.LibraryVariant;
import com.defold.prefab.MalformedModuleException;
import com.defold.prefab.Module;
import com.defold.prefab.PrefabException;
import com.defold.prefab.RedundantLibrariesException;
import com.defold.prefab.SchemaVersion;
import com.defold.prefab.metadata.GnuLinuxAbiMetadataV1;
import com.defold.prefab.metadata.SchemaMigrations;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A GNU/Linux target, identified by Debian architecture name and glibc version.
 */
public class GnuLinux extends PlatformIdentity {
    public static final String IDENTIFIER = "gnulinux";

    public static final PlatformFactory FACTORY = new Factory();

    private final Arch arch;
    private final GlibcVersion glibcVersion;
    private final boolean isStatic;

    public GnuLinux(Arch arch, GlibcVersion glibcVersion) {
        this(arch, glibcVersion, false);
    }

    public GnuLinux(Arch arch, GlibcVersion glibcVersion, boolean isStatic) {
        this.arch = arch;
        this.glibcVersion = glibcVersion;
        this.isStatic = isStatic;
    }

    public Arch getArch() {
        return arch;
    }

    public GlibcVersion getGlibcVersion() {
        return glibcVersion;
    }

    @Override
    public boolean isStaticArtifact() {
        return isStatic;
    }

    @Override
    public PlatformFactory getFactory() {
        return FACTORY;
    }

    @Override
    public String getTargetTriple() {
        return arch.getTriple();
    }

    @Override
    public LibraryUsability checkIfUsable(LibraryVariant library) {
        if (!(library.getPlatform() instanceof GnuLinux)) {
            return new LibraryUsability.IncompatibleLibrary("Library is not a GNU/Linux library");
        }
        GnuLinux other = (GnuLinux) library.getPlatform();
        if (arch != other.arch) {
            return new LibraryUsability.IncompatibleLibrary(String.format("User is targeting %s but library is for %s",
                    arch.getArchName(), other.arch.getArchName()));
        }
        if (glibcVersion.compareTo(other.glibcVersion) < 0) {
            return new LibraryUsability.IncompatibleLibrary(String.format("User has glibc %s but library was built for %s",
                    glibcVersion, other.glibcVersion));
        }
        return LibraryUsability.CompatibleLibrary.INSTANCE;
    }

    @Override
    protected LibraryVariant selectBestMatch(Module module, List<LibraryVariant> libraries) throws MalformedModuleException {
        for (LibraryVariant library : libraries) {
            Validate.isInstanceOf(GnuLinux.class, library.getPlatform(), "library must be a GNU/Linux library");
        }
        GlibcVersion newest = Collections.max(libraries.stream()
                .map(l -> ((GnuLinux) l.getPlatform()).glibcVersion)
                .collect(Collectors.toList()));
        List<LibraryVariant> matches = libraries.stream()
                .filter(l -> ((GnuLinux) l.getPlatform()).glibcVersion.equals(newest))
                .collect(Collectors.toList());
        if (matches.size() == 1) {
            return matches.get(0);
        }
        throw new RedundantLibrariesException(module, matches);
    }

    @Override
    public String toString() {
        return String.format("GnuLinux(%s, %s)", arch, glibcVersion);
    }

    /**
     * A Debian architecture name.
     */
    public enum Arch {
        AMD64("amd64", "x86_64-linux-gnu"),
        ARM64("arm64", "aarch64-linux-gnu"),
        ARMHF("armhf", "arm-linux-gnueabihf"),
        I386("i386", "i386-linux-gnu"),
        PPC64EL("ppc64el", "powerpc64le-linux-gnu");

        private final String archName;
        private final String triple;

        Arch(String archName, String triple) {
            this.archName = archName;
            this.triple = triple;
        }

        public String getArchName() {
            return archName;
        }

        public String getTriple() {
            return triple;
        }

        public static Arch fromString(String value) {
            for (Arch arch : values()) {
                if (arch.archName.equals(value)) {
                    return arch;
                }
            }
            throw new IllegalArgumentException(String.format("Unknown architecture: %s", value));
        }
    }

    public static final class GlibcVersion implements Comparable<GlibcVersion> {
        private final int major;
        private final int minor;

        public GlibcVersion(int major, int minor) {
            this.major = major;
            this.minor = minor;
        }

        /**
         * @param value A version of the form major.minor, e.g. 2.31
         */
        public static GlibcVersion fromString(String value) {
            if (value == null || StringUtils.countMatches(value, '.') != 1) {
                throw new IllegalArgumentException(String.format("Expected exactly one . in glibc version string: %s", value));
            }
            String major = StringUtils.substringBefore(value, ".");
            String minor = StringUtils.substringAfter(value, ".");
            if (!StringUtils.isNumeric(major) || !StringUtils.isNumeric(minor)) {
                throw new IllegalArgumentException(String.format("Invalid glibc version: %s", value));
            }
            return new GlibcVersion(Integer.parseInt(major), Integer.parseInt(minor));
        }

        public int getMajor() {
            return major;
        }

        public int getMinor() {
            return minor;
        }

        @Override
        public int compareTo(GlibcVersion other) {
            int result = Integer.compare(major, other.major);
            return result != 0 ? result : Integer.compare(minor, other.minor);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof GlibcVersion)) {
                return false;
            }
            GlibcVersion other = (GlibcVersion) o;
            return major == other.major && minor == other.minor;
        }

        @Override
        public int hashCode() {
            return Objects.hash(major, minor);
        }

        @Override
        public String toString() {
            return major + "." + minor;
        }
    }

    private static final class Factory implements PlatformFactory {

        @Override
        public String getIdentifier() {
            return IDENTIFIER;
        }

        @Override
        public LibraryVariant libraryFromDirectory(Path directory, Module module, SchemaVersion schemaVersion)
                throws PrefabException {
            GnuLinuxAbiMetadataV1 metadata = SchemaMigrations.GNU_LINUX_ABI.loadAndMigrate(schemaVersion, directory, module);
            Path library = ElfLibraries.find(directory, libraryNameFor(module));
            GnuLinux platform;
            try {
                platform = new GnuLinux(Arch.fromString(metadata.getArch()),
                        GlibcVersion.fromString(metadata.getGlibcVersion()),
                        ElfLibraries.isStaticArchive(library));
            } catch (IllegalArgumentException e) {
                throw new InvalidMetadataException(directory.resolve(SchemaMigrations.GNU_LINUX_ABI.getFileName()), e);
            }
            return new LibraryVariant(library, module, platform);
        }
    }
}
