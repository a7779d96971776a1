package com.defold.prefab.platform;

import com.defold.prefab.InvalidMetadataException;
import com.defold.prefab.LibraryVariant;
import com.defold.prefab.MalformedModuleException;
import com.defold.prefab.MissingToolchainVariantException;
import com.defold.prefab.Module;
import com.defold.prefab.PrefabException;
import com.defold.prefab.RedundantLibrariesException;
import com.defold.prefab.SchemaVersion;
import com.defold.prefab.metadata.AndroidAbiMetadataV2;
import com.defold.prefab.metadata.SchemaMigrations;
import org.apache.commons.lang3.Validate;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An Android target.
 *
 * 64-bit ABIs did not exist before API 21, so their API level is never lower than 21.
 */
public class Android extends PlatformIdentity {
    public static final String IDENTIFIER = "android";
    public static final int FIRST_64_BIT_API = 21;

    public static final PlatformFactory FACTORY = new Factory();

    private final Abi abi;
    private final int api;
    private final Stl stl;
    private final int ndkMajorVersion;
    private final boolean isStatic;

    /**
     * Describes the requirements of a user.
     *
     * @param abi             The targeted ABI
     * @param api             The minSdkVersion of the user
     * @param stl             The STL the user links
     * @param ndkMajorVersion The major version of the NDK in use
     */
    public Android(Abi abi, int api, Stl stl, int ndkMajorVersion) {
        this(abi, api, stl, ndkMajorVersion, false);
    }

    public Android(Abi abi, int api, Stl stl, int ndkMajorVersion, boolean isStatic) {
        this.abi = abi;
        this.api = abi.is64Bit() ? Math.max(api, FIRST_64_BIT_API) : api;
        this.stl = stl;
        this.ndkMajorVersion = ndkMajorVersion;
        this.isStatic = isStatic;
    }

    public Abi getAbi() {
        return abi;
    }

    public int getApi() {
        return api;
    }

    public Stl getStl() {
        return stl;
    }

    public int getNdkMajorVersion() {
        return ndkMajorVersion;
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
        return abi.getTriple();
    }

    @Override
    public LibraryUsability checkIfUsable(LibraryVariant library) {
        if (!(library.getPlatform() instanceof Android)) {
            return new LibraryUsability.IncompatibleLibrary("Library is not an Android library");
        }
        Android other = (Android) library.getPlatform();
        if (abi != other.abi) {
            return new LibraryUsability.IncompatibleLibrary(String.format("User is targeting %s but library is for %s",
                    abi.getTargetArchAbi(), other.abi.getTargetArchAbi()));
        }
        if (api < other.api) {
            return new LibraryUsability.IncompatibleLibrary(String.format("User has minSdkVersion %d but library was built for %d",
                    api, other.api));
        }
        return checkStlCompatibility(other);
    }

    private LibraryUsability checkStlCompatibility(Android library) {
        // A user that statically links an STL but hides it behind a version script should declare "none".

        if (library.stl.getFamily() == Stl.Family.NONE) {
            return LibraryUsability.CompatibleLibrary.INSTANCE;
        }

        // Also rejects STL users when the user picked none or system, since mixing families is worse.
        if (stl.getFamily() != library.stl.getFamily()) {
            return new LibraryUsability.IncompatibleLibrary(String.format("User requested %s but library requires %s",
                    stl.getFamily().getFamilyName(), library.stl.getFamily().getFamilyName()));
        }

        // A static library links whatever STL its consumer picks.
        if (library.isStatic) {
            return LibraryUsability.CompatibleLibrary.INSTANCE;
        }

        if (!library.stl.isShared()) {
            return new LibraryUsability.IncompatibleLibrary(
                    "Library is a shared library with a statically linked STL and cannot be used with any library using the STL");
        }

        if (!stl.isShared()) {
            return new LibraryUsability.IncompatibleLibrary("User is using a static STL but library requires a shared STL");
        }

        return LibraryUsability.CompatibleLibrary.INSTANCE;
    }

    @Override
    protected LibraryVariant selectBestMatch(Module module, List<LibraryVariant> libraries) throws MalformedModuleException {
        for (LibraryVariant library : libraries) {
            Validate.isInstanceOf(Android.class, library.getPlatform(), "library must be an Android library");
        }

        // Libraries built for a newer API level may use newer system APIs and are often smaller.
        int bestApi = libraries.stream().mapToInt(l -> asAndroid(l).api).max().getAsInt();
        List<LibraryVariant> bestApiMatches = libraries.stream()
                .filter(l -> asAndroid(l).api == bestApi)
                .collect(Collectors.toList());
        if (bestApiMatches.size() == 1) {
            return bestApiMatches.get(0);
        }

        // Use the closest NDK the module supports when the user's NDK is outside that range.
        int minNdk = bestApiMatches.stream().mapToInt(l -> asAndroid(l).ndkMajorVersion).min().getAsInt();
        int maxNdk = bestApiMatches.stream().mapToInt(l -> asAndroid(l).ndkMajorVersion).max().getAsInt();
        int clamped = Math.max(minNdk, Math.min(ndkMajorVersion, maxNdk));
        List<LibraryVariant> ndkMatches = bestApiMatches.stream()
                .filter(l -> asAndroid(l).ndkMajorVersion == clamped)
                .collect(Collectors.toList());

        if (ndkMatches.isEmpty()) {
            throw new MissingToolchainVariantException(module, ndkMajorVersion);
        }
        if (ndkMatches.size() == 1) {
            return ndkMatches.get(0);
        }
        throw new RedundantLibrariesException(module, ndkMatches);
    }

    private static Android asAndroid(LibraryVariant library) {
        return (Android) library.getPlatform();
    }

    @Override
    public String toString() {
        return String.format("Android(%s, %d, %s)", abi, api, stl);
    }

    /**
     * An Android ABI.
     */
    public enum Abi {
        ARM32("armeabi-v7a", "arm-linux-androideabi", false),
        ARM64("arm64-v8a", "aarch64-linux-android", true),
        X86("x86", "i686-linux-android", false),
        X86_64("x86_64", "x86_64-linux-android", true);

        private final String targetArchAbi;
        private final String triple;
        private final boolean is64Bit;

        Abi(String targetArchAbi, String triple, boolean is64Bit) {
            this.targetArchAbi = targetArchAbi;
            this.triple = triple;
            this.is64Bit = is64Bit;
        }

        /**
         * @return The ABI name as used by APP_ABI and ANDROID_ABI, e.g. arm64-v8a
         */
        public String getTargetArchAbi() {
            return targetArchAbi;
        }

        /**
         * @return The library architecture triple. 32-bit Arm is arm-linux-androideabi rather than armv7a.
         */
        public String getTriple() {
            return triple;
        }

        public boolean is64Bit() {
            return is64Bit;
        }

        public static Abi fromString(String value) {
            for (Abi abi : values()) {
                if (abi.targetArchAbi.equals(value)) {
                    return abi;
                }
            }
            throw new IllegalArgumentException(String.format("Unknown ABI: %s", value));
        }
    }

    /**
     * An Android STL. Includes STLs that current NDKs no longer ship so that old packages can still be used.
     */
    public enum Stl {
        CXX_SHARED("c++_shared", Family.CXX, true),
        CXX_STATIC("c++_static", Family.CXX, false),
        GNUSTL_SHARED("gnustl_shared", Family.GNUSTL, true),
        GNUSTL_STATIC("gnustl_static", Family.GNUSTL, false),
        NONE("none", Family.NONE, false),
        STLPORT_SHARED("stlport_shared", Family.STLPORT, true),
        STLPORT_STATIC("stlport_static", Family.STLPORT, false),
        // Bionic's libstdc++. Same linking requirements as none.
        SYSTEM("system", Family.NONE, true);

        private final String stlName;
        private final Family family;
        private final boolean isShared;

        Stl(String stlName, Family family, boolean isShared) {
            this.stlName = stlName;
            this.family = family;
            this.isShared = isShared;
        }

        public String getStlName() {
            return stlName;
        }

        public Family getFamily() {
            return family;
        }

        public boolean isShared() {
            return isShared;
        }

        public static Stl fromString(String value) {
            for (Stl stl : values()) {
                if (stl.stlName.equals(value)) {
                    return stl;
                }
            }
            throw new IllegalArgumentException(String.format("Unknown STL: %s", value));
        }

        public enum Family {
            CXX("libc++"),
            GNUSTL("libstdc++"),
            // STLs with no linking restrictions.
            NONE("no STL"),
            STLPORT("STLport");

            private final String familyName;

            Family(String familyName) {
                this.familyName = familyName;
            }

            public String getFamilyName() {
                return familyName;
            }
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
            AndroidAbiMetadataV2 metadata = SchemaMigrations.ANDROID_ABI.loadAndMigrate(schemaVersion, directory, module);
            Android platform;
            try {
                platform = new Android(Abi.fromString(metadata.getAbi()), metadata.getApi(),
                        Stl.fromString(metadata.getStl()), metadata.getNdk(), metadata.isStatic());
            } catch (IllegalArgumentException e) {
                throw new InvalidMetadataException(directory.resolve(SchemaMigrations.ANDROID_ABI.getFileName()), e);
            }
            Path library = ElfLibraries.libraryPath(directory, libraryNameFor(module), metadata.isStatic());
            return new LibraryVariant(library, module, platform);
        }
    }
}
