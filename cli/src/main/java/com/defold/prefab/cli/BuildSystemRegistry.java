package com.defold.prefab.cli;

import com.defold.prefab.buildsystem.BuildSystemProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * The build systems registered as {@link BuildSystemProvider} services.
 */
public final class BuildSystemRegistry {
    private static final List<BuildSystemProvider> PROVIDERS;

    static {
        List<BuildSystemProvider> providers = new ArrayList<>();
        ServiceLoader.load(BuildSystemProvider.class).forEach(providers::add);
        PROVIDERS = Collections.unmodifiableList(providers);
    }

    private BuildSystemRegistry() {
    }

    /**
     * @return The provider with the identifier, or null if none is registered
     */
    public static BuildSystemProvider find(String identifier) {
        for (BuildSystemProvider provider : PROVIDERS) {
            if (provider.getIdentifier().equals(identifier)) {
                return provider;
            }
        }
        return null;
    }

    public static List<String> getIdentifiers() {
        return PROVIDERS.stream().map(BuildSystemProvider::getIdentifier).sorted().collect(Collectors.toList());
    }
}
