package com.defold.prefab;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The module does not contain a library compatible with the user's requirements.
 *
 * Build system plugins usually log and skip the module when this is thrown.
 */
public class NoMatchingLibraryException extends PrefabException {
    private final Module module;
    private final Map<LibraryVariant, String> rejections;

    /**
     * @param module     The module that was searched
     * @param rejections Every library of the module mapped to the reason it was rejected, in report order
     */
    public NoMatchingLibraryException(Module module, Map<LibraryVariant, String> rejections) {
        super(formatMessage(module, rejections));
        this.module = module;
        this.rejections = Collections.unmodifiableMap(new LinkedHashMap<>(rejections));
    }

    private static String formatMessage(Module module, Map<LibraryVariant, String> rejections) {
        String details = rejections.entrySet().stream()
                .map(e -> String.format("%s: %s", e.getKey().getDirectory().getFileName(), e.getValue()))
                .collect(Collectors.joining("\n"));
        return String.format("No compatible library found for %s. Rejected the following libraries:\n%s",
                module.getCanonicalName(), details);
    }

    public Module getModule() {
        return module;
    }

    public Map<LibraryVariant, String> getRejections() {
        return rejections;
    }
}
