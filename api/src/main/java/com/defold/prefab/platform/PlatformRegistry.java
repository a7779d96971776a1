package com.defold.prefab.platform;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The supported platforms keyed by platform ID.
 */
public final class PlatformRegistry {
    private static final Map<String, PlatformFactory> FACTORIES;

    static {
        Map<String, PlatformFactory> factories = new LinkedHashMap<>();
        for (PlatformFactory factory : Arrays.asList(Android.FACTORY, GnuLinux.FACTORY)) {
            factories.put(factory.getIdentifier(), factory);
        }
        FACTORIES = Collections.unmodifiableMap(factories);
    }

    private PlatformRegistry() {
    }

    /**
     * @return The factory for the platform ID, or null if the platform is not supported
     */
    public static PlatformFactory find(String identifier) {
        return FACTORIES.get(identifier);
    }

    public static Set<String> getIdentifiers() {
        return FACTORIES.keySet();
    }
}
