package com.defold.prefab.platform;

import com.defold.prefab.LibraryVariant;
import com.defold.prefab.MissingToolchainVariantException;
import com.defold.prefab.Module;
import com.defold.prefab.RedundantLibrariesException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class AndroidTest {

    private Module module;

    @BeforeEach
    public void setUp() {
        module = mock(Module.class);
        when(module.getCanonicalName()).thenReturn("//foo/bar");
        when(module.getIncludePath()).thenReturn(Paths.get("/foo/modules/bar/include"));
    }

    private LibraryVariant library(String directory, Android platform) {
        String name = platform.isStaticArtifact() ? "libbar.a" : "libbar.so";
        return new LibraryVariant(Paths.get("/foo/modules/bar/libs", directory, name), module, platform);
    }

    private LibraryVariant library(Android.Abi abi, int api, Android.Stl stl, int ndk, boolean isStatic) {
        return library(String.format("android.%s_%d_%s_%d", abi.getTargetArchAbi(), api, stl.getStlName(), ndk),
                new Android(abi, api, stl, ndk, isStatic));
    }

    private static String reason(LibraryUsability usability) {
        assertFalse(usability.isCompatible());
        return ((LibraryUsability.IncompatibleLibrary) usability).getReason();
    }

    @Test
    public void testAbiFromString() {
        assertEquals(Android.Abi.ARM32, Android.Abi.fromString("armeabi-v7a"));
        assertEquals(Android.Abi.ARM64, Android.Abi.fromString("arm64-v8a"));
        assertEquals(Android.Abi.X86, Android.Abi.fromString("x86"));
        assertEquals(Android.Abi.X86_64, Android.Abi.fromString("x86_64"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Android.Abi.fromString("mips"));
        assertEquals("Unknown ABI: mips", e.getMessage());
    }

    @Test
    public void testStlFromString() {
        for (Android.Stl stl : Android.Stl.values()) {
            assertEquals(stl, Android.Stl.fromString(stl.getStlName()));
        }
        assertThrows(IllegalArgumentException.class, () -> Android.Stl.fromString("libc++"));
    }

    @Test
    public void testTargetTriple() {
        assertEquals("arm-linux-androideabi", new Android(Android.Abi.ARM32, 16, Android.Stl.CXX_SHARED, 21).getTargetTriple());
        assertEquals("aarch64-linux-android", new Android(Android.Abi.ARM64, 21, Android.Stl.CXX_SHARED, 21).getTargetTriple());
        assertEquals("i686-linux-android", new Android(Android.Abi.X86, 16, Android.Stl.CXX_SHARED, 21).getTargetTriple());
        assertEquals("x86_64-linux-android", new Android(Android.Abi.X86_64, 21, Android.Stl.CXX_SHARED, 21).getTargetTriple());
    }

    @Test
    public void testApiIsRaisedFor64BitAbis() {
        for (int api = 16; api < 21; api++) {
            assertEquals(21, new Android(Android.Abi.ARM64, api, Android.Stl.CXX_SHARED, 21).getApi());
            assertEquals(21, new Android(Android.Abi.X86_64, api, Android.Stl.CXX_SHARED, 21).getApi());
            assertEquals(api, new Android(Android.Abi.ARM32, api, Android.Stl.CXX_SHARED, 21).getApi());
            assertEquals(api, new Android(Android.Abi.X86, api, Android.Stl.CXX_SHARED, 21).getApi());
        }
        assertEquals(28, new Android(Android.Abi.ARM64, 28, Android.Stl.CXX_SHARED, 21).getApi());
    }

    @Test
    public void testDifferentAbisAreIncompatible() {
        for (Android.Abi requested : Android.Abi.values()) {
            for (Android.Abi available : Android.Abi.values()) {
                Android requirement = new Android(requested, 21, Android.Stl.CXX_SHARED, 21);
                LibraryUsability usability = requirement.checkIfUsable(library(available, 21, Android.Stl.CXX_SHARED, 21, false));
                assertEquals(requested == available, usability.isCompatible());
            }
        }

        Android requirement = new Android(Android.Abi.ARM64, 21, Android.Stl.CXX_SHARED, 21);
        assertEquals("User is targeting arm64-v8a but library is for x86_64",
                reason(requirement.checkIfUsable(library(Android.Abi.X86_64, 21, Android.Stl.CXX_SHARED, 21, false))));
    }

    @Test
    public void testNewerTargetCanUseOlderLibrary() {
        Android older = new Android(Android.Abi.ARM32, 19, Android.Stl.CXX_SHARED, 21);
        Android newer = new Android(Android.Abi.ARM32, 24, Android.Stl.CXX_SHARED, 21);

        assertTrue(newer.checkIfUsable(library(Android.Abi.ARM32, 19, Android.Stl.CXX_SHARED, 21, false)).isCompatible());
        assertTrue(older.checkIfUsable(library(Android.Abi.ARM32, 19, Android.Stl.CXX_SHARED, 21, false)).isCompatible());
        assertEquals("User has minSdkVersion 19 but library was built for 24",
                reason(older.checkIfUsable(library(Android.Abi.ARM32, 24, Android.Stl.CXX_SHARED, 21, false))));
    }

    @Test
    public void testNonAndroidLibraryIsIncompatible() {
        Android requirement = new Android(Android.Abi.ARM64, 21, Android.Stl.CXX_SHARED, 21);
        LibraryVariant linux = new LibraryVariant(Paths.get("/foo/modules/bar/libs/gnulinux.amd64/libbar.so"), module,
                new GnuLinux(GnuLinux.Arch.AMD64, new GnuLinux.GlibcVersion(2, 31)));
        assertEquals("Library is not an Android library", reason(requirement.checkIfUsable(linux)));
    }

    @Test
    public void testStlCompatibility() {
        Android.Stl[] requested = {
                Android.Stl.CXX_SHARED, Android.Stl.CXX_STATIC, Android.Stl.GNUSTL_SHARED, Android.Stl.NONE, Android.Stl.SYSTEM
        };

        // Columns: static library, shared library with a shared STL, shared library with a static STL.
        boolean[][][] expected = {
                // c++_shared
                {{true, true, false}, {false, false, false}, {true, true, true}},
                // c++_static
                {{true, false, false}, {false, false, false}, {true, true, true}},
                // gnustl_shared
                {{false, false, false}, {true, true, false}, {true, true, true}},
                // none
                {{false, false, false}, {false, false, false}, {true, true, true}},
                // system
                {{false, false, false}, {false, false, false}, {true, true, true}},
        };
        // Rows of each block: libc++ library, libstdc++ library, no STL library.
        Android.Stl[][] libraryStls = {
                {Android.Stl.CXX_STATIC, Android.Stl.CXX_SHARED, Android.Stl.CXX_STATIC},
                {Android.Stl.GNUSTL_STATIC, Android.Stl.GNUSTL_SHARED, Android.Stl.GNUSTL_STATIC},
                {Android.Stl.NONE, Android.Stl.SYSTEM, Android.Stl.NONE},
        };

        for (int r = 0; r < requested.length; r++) {
            Android requirement = new Android(Android.Abi.ARM64, 21, requested[r], 21);
            for (int family = 0; family < libraryStls.length; family++) {
                LibraryVariant staticLibrary = library(Android.Abi.ARM64, 21, libraryStls[family][0], 21, true);
                LibraryVariant sharedWithSharedStl = library(Android.Abi.ARM64, 21, libraryStls[family][1], 21, false);
                LibraryVariant sharedWithStaticStl = library(Android.Abi.ARM64, 21, libraryStls[family][2], 21, false);
                String where = requested[r].getStlName() + " using family " + family;
                assertEquals(expected[r][family][0], requirement.checkIfUsable(staticLibrary).isCompatible(), where + " static");
                assertEquals(expected[r][family][1], requirement.checkIfUsable(sharedWithSharedStl).isCompatible(), where + " shared/shared");
                assertEquals(expected[r][family][2], requirement.checkIfUsable(sharedWithStaticStl).isCompatible(), where + " shared/static");
            }
        }
    }

    @Test
    public void testStlRejectionReasons() {
        Android cxxShared = new Android(Android.Abi.ARM64, 21, Android.Stl.CXX_SHARED, 21);
        Android cxxStatic = new Android(Android.Abi.ARM64, 21, Android.Stl.CXX_STATIC, 21);
        Android none = new Android(Android.Abi.ARM64, 21, Android.Stl.NONE, 21);

        assertEquals("User requested libc++ but library requires libstdc++",
                reason(cxxShared.checkIfUsable(library(Android.Abi.ARM64, 21, Android.Stl.GNUSTL_SHARED, 21, false))));
        assertEquals("User requested no STL but library requires libc++",
                reason(none.checkIfUsable(library(Android.Abi.ARM64, 21, Android.Stl.CXX_SHARED, 21, false))));
        assertEquals("Library is a shared library with a statically linked STL and cannot be used with any library using the STL",
                reason(cxxShared.checkIfUsable(library(Android.Abi.ARM64, 21, Android.Stl.CXX_STATIC, 21, false))));
        assertEquals("User is using a static STL but library requires a shared STL",
                reason(cxxStatic.checkIfUsable(library(Android.Abi.ARM64, 21, Android.Stl.CXX_SHARED, 21, false))));
    }

    @Test
    public void testFindBestMatchPrefersNewestApi() throws Exception {
        LibraryVariant api21 = library(Android.Abi.ARM32, 21, Android.Stl.CXX_SHARED, 21, false);
        LibraryVariant api23 = library(Android.Abi.ARM32, 23, Android.Stl.CXX_SHARED, 21, false);
        LibraryVariant api24 = library(Android.Abi.ARM32, 24, Android.Stl.CXX_SHARED, 21, false);

        Android at24 = new Android(Android.Abi.ARM32, 24, Android.Stl.CXX_SHARED, 21);
        assertSame(api24, at24.findBestMatch(Arrays.asList(api21, api24, api23)));

        Android at26 = new Android(Android.Abi.ARM32, 26, Android.Stl.CXX_SHARED, 21);
        assertSame(api24, at26.findBestMatch(Arrays.asList(api23, api21, api24)));
    }

    @Test
    public void testSingleApiMatchIgnoresNdkVersion() throws Exception {
        LibraryVariant ndk18 = library(Android.Abi.ARM32, 16, Android.Stl.CXX_SHARED, 18, false);
        LibraryVariant ndk25 = library(Android.Abi.ARM32, 19, Android.Stl.CXX_SHARED, 25, false);
        Android requirement = new Android(Android.Abi.ARM32, 21, Android.Stl.CXX_SHARED, 18);
        assertSame(ndk25, requirement.findBestMatch(Arrays.asList(ndk18, ndk25)));
    }

    @Test
    public void testFindBestMatchClampsNdkVersion() throws Exception {
        LibraryVariant ndk18 = library(Android.Abi.ARM32, 21, Android.Stl.CXX_SHARED, 18, false);
        LibraryVariant ndk19 = library(Android.Abi.ARM32, 21, Android.Stl.CXX_SHARED, 19, false);
        LibraryVariant ndk20 = library(Android.Abi.ARM32, 21, Android.Stl.CXX_SHARED, 20, false);
        LibraryVariant ndk21 = library(Android.Abi.ARM32, 21, Android.Stl.CXX_SHARED, 21, false);
        List<LibraryVariant> libraries = Arrays.asList(ndk18, ndk19, ndk20, ndk21);

        assertSame(ndk21, new Android(Android.Abi.ARM32, 21, Android.Stl.CXX_SHARED, 22).findBestMatch(libraries));
        assertSame(ndk18, new Android(Android.Abi.ARM32, 21, Android.Stl.CXX_SHARED, 17).findBestMatch(libraries));
        assertSame(ndk20, new Android(Android.Abi.ARM32, 21, Android.Stl.CXX_SHARED, 20).findBestMatch(libraries));
    }

    @Test
    public void testGapInNdkVersionsIsFatal() {
        LibraryVariant ndk18 = library(Android.Abi.ARM32, 21, Android.Stl.CXX_SHARED, 18, false);
        LibraryVariant ndk20 = library(Android.Abi.ARM32, 21, Android.Stl.CXX_SHARED, 20, false);
        Android requirement = new Android(Android.Abi.ARM32, 21, Android.Stl.CXX_SHARED, 19);

        MissingToolchainVariantException e = assertThrows(MissingToolchainVariantException.class,
                () -> requirement.findBestMatch(Arrays.asList(ndk18, ndk20)));
        assertEquals("//foo/bar contains a library per NDK version but no match was found for 19", e.getMessage());
        assertEquals(19, e.getToolchainVersion());
    }

    @Test
    public void testIndistinguishableLibrariesAreRedundant() {
        LibraryVariant staticStl = library(Android.Abi.ARM32, 21, Android.Stl.CXX_STATIC, 21, true);
        LibraryVariant sharedStl = library(Android.Abi.ARM32, 21, Android.Stl.CXX_SHARED, 21, true);
        Android requirement = new Android(Android.Abi.ARM32, 21, Android.Stl.CXX_SHARED, 21);

        RedundantLibrariesException e = assertThrows(RedundantLibrariesException.class,
                () -> requirement.findBestMatch(Arrays.asList(staticStl, sharedStl)));
        assertEquals(Arrays.asList(staticStl, sharedStl), e.getLibraries());
        assertTrue(e.getMessage().startsWith(
                "Unable to resolve a single library match for //foo/bar. The following libraries are redundant:\n"));
        assertTrue(e.getMessage().contains(staticStl.getDirectory().toString()));
        assertTrue(e.getMessage().contains(sharedStl.getDirectory().toString()));
    }

    @Test
    public void testFindBestMatchPreconditions() {
        Android requirement = new Android(Android.Abi.ARM32, 21, Android.Stl.CXX_SHARED, 21);

        assertThrows(IllegalArgumentException.class, () -> requirement.findBestMatch(Collections.emptyList()));

        LibraryVariant incompatible = library(Android.Abi.X86, 21, Android.Stl.CXX_SHARED, 21, false);
        assertThrows(IllegalArgumentException.class, () -> requirement.findBestMatch(Collections.singletonList(incompatible)));

        Module other = mock(Module.class);
        LibraryVariant compatible = library(Android.Abi.ARM32, 21, Android.Stl.CXX_SHARED, 21, false);
        LibraryVariant foreign = new LibraryVariant(Paths.get("/foo/modules/baz/libs/android.armeabi-v7a/libbaz.so"), other,
                new Android(Android.Abi.ARM32, 21, Android.Stl.CXX_SHARED, 21));
        assertThrows(IllegalArgumentException.class, () -> requirement.findBestMatch(Arrays.asList(compatible, foreign)));
    }
}
