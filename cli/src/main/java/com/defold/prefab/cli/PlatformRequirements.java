package com.defold.prefab.cli;

import com.defold.prefab.platform.Android;
import com.defold.prefab.platform.GnuLinux;
import com.defold.prefab.platform.PlatformIdentity;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the user's target platforms from the command line options.
 */
public final class PlatformRequirements {
    public static final String DEFAULT_STL = Android.Stl.CXX_SHARED.getStlName();

    private PlatformRequirements() {
    }

    /**
     * @param platform   The platform ID, "android" or "gnulinux"
     * @param abis       The requested ABIs. Android builds for every ABI when empty; GNU/Linux requires exactly one
     * @param osVersion  The minSdkVersion for Android, the glibc version for GNU/Linux
     * @param stl        The Android STL, {@link #DEFAULT_STL} when null
     * @param ndkVersion The major version of the NDK, Android only
     * @throws IllegalArgumentException The options do not describe a valid target
     */
    public static List<PlatformIdentity> create(String platform, List<String> abis, String osVersion, String stl,
                                                Integer ndkVersion) {
        if (platform == null) {
            throw new IllegalArgumentException("A target platform is required");
        }
        switch (platform) {
            case Android.IDENTIFIER:
                return createAndroid(abis, osVersion, stl, ndkVersion);
            case GnuLinux.IDENTIFIER:
                return createGnuLinux(abis, osVersion);
            default:
                throw new IllegalArgumentException(String.format("Unsupported platform: %s", platform));
        }
    }

    private static List<PlatformIdentity> createAndroid(List<String> abis, String osVersion, String stl, Integer ndkVersion) {
        if (osVersion == null) {
            throw new IllegalArgumentException("Android targets require an OS version");
        }
        if (ndkVersion == null) {
            throw new IllegalArgumentException("Android targets require an NDK version");
        }
        int api;
        try {
            api = Integer.parseInt(osVersion);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Android OS version must be an integer: %s", osVersion), e);
        }
        Android.Stl parsedStl = Android.Stl.fromString(stl != null ? stl : DEFAULT_STL);

        List<Android.Abi> targetAbis = new ArrayList<>();
        if (abis == null || abis.isEmpty()) {
            targetAbis.addAll(List.of(Android.Abi.values()));
        } else {
            for (String abi : abis) {
                targetAbis.add(Android.Abi.fromString(abi));
            }
        }

        List<PlatformIdentity> requirements = new ArrayList<>();
        for (Android.Abi abi : targetAbis) {
            requirements.add(new Android(abi, api, parsedStl, ndkVersion));
        }
        return requirements;
    }

    private static List<PlatformIdentity> createGnuLinux(List<String> abis, String osVersion) {
        if (abis == null || abis.size() != 1) {
            throw new IllegalArgumentException("GNU/Linux targets require exactly one ABI");
        }
        if (osVersion == null) {
            throw new IllegalArgumentException("GNU/Linux targets require an OS version");
        }
        List<PlatformIdentity> requirements = new ArrayList<>();
        requirements.add(new GnuLinux(GnuLinux.Arch.fromString(abis.get(0)), GnuLinux.GlibcVersion.fromString(osVersion)));
        return requirements;
    }
}
