package com.defold.prefab.cli;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defaults for the command line options, read from the file given with {@code --config}.
 *
 * <pre>
 * buildSystem: cmake
 * platform: android
 * abis: [arm64-v8a]
 * osVersion: "21"
 * ndkVersion: 25
 * </pre>
 */
public class CliConfiguration {
    public String buildSystem;
    public String output;
    public String platform;
    public List<String> abis;
    public String osVersion;
    public String stl;
    public Integer ndkVersion;

    public static CliConfiguration load(Path file) throws IOException {
        Yaml yaml = new Yaml(new Constructor(CliConfiguration.class, new LoaderOptions()));
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            CliConfiguration configuration = yaml.load(reader);
            return configuration != null ? configuration : new CliConfiguration();
        } catch (YAMLException e) {
            throw new IOException(String.format("Invalid configuration file %s: %s", file, e.getMessage()), e);
        }
    }
}
