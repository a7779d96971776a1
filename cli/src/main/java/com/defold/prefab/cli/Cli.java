package com.defold.prefab.cli;

import ch.qos.logback.classic.Level;
import com.defold.prefab.Package;
import com.defold.prefab.PrefabException;
import com.defold.prefab.buildsystem.BuildSystem;
import com.defold.prefab.buildsystem.BuildSystemProvider;
import com.defold.prefab.platform.PlatformIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(
    name = "prefab",
    mixinStandardHelpOptions = true,
    version = "prefab 2.1.0",
    description = "Generates build system integration for prebuilt native library packages."
)
public class Cli implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Cli.class);

    @Spec
    private CommandSpec spec;

    @Option(names = "--build-system", description = "Generate integration for the given build system.")
    private String buildSystem;

    @Option(names = "--output", description = "Output path for generated build system integration.")
    private Path output;

    @Option(names = "--platform", description = "Target platform: android or gnulinux.")
    private String platform;

    @Option(names = "--abi", description = "Target ABI. May be repeated. Android defaults to every ABI.")
    private List<String> abis = new ArrayList<>();

    @Option(names = "--os-version", description = "Target OS version: minSdkVersion for Android, glibc version for GNU/Linux.")
    private String osVersion;

    @Option(names = "--stl", description = "Android STL. Defaults to c++_shared.")
    private String stl;

    @Option(names = "--ndk-version", description = "Major version of the NDK in use.")
    private Integer ndkVersion;

    @Option(names = {"-c", "--config"}, description = "YAML file with defaults for the options above.")
    private Path configFile;

    @Option(names = {"-v", "--verbose"}, description = "Log debug output.")
    private boolean verbose;

    @Parameters(paramLabel = "PACKAGE_PATH", arity = "1..*", description = "Package directories.")
    private List<Path> packagePaths = new ArrayList<>();

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    public static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new Cli());
        commandLine.setCommandName("prefab");
        return commandLine;
    }

    @Override
    public Integer call() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.defold.prefab")).setLevel(Level.DEBUG);
        }
        try {
            applyConfiguration();
            run();
            return 0;
        } catch (PrefabException | IOException | IllegalArgumentException | UnsupportedOperationException e) {
            LOGGER.error(e.getMessage());
            LOGGER.debug("Stack trace", e);
            return 1;
        }
    }

    private void applyConfiguration() throws IOException {
        if (configFile == null) {
            return;
        }
        LOGGER.debug("Reading configuration from {}", configFile);
        CliConfiguration configuration = CliConfiguration.load(configFile);
        if (buildSystem == null) {
            buildSystem = configuration.buildSystem;
        }
        if (output == null && configuration.output != null) {
            output = Paths.get(configuration.output);
        }
        if (platform == null) {
            platform = configuration.platform;
        }
        if (abis.isEmpty() && configuration.abis != null) {
            abis = new ArrayList<>(configuration.abis);
        }
        if (osVersion == null) {
            osVersion = configuration.osVersion;
        }
        if (stl == null) {
            stl = configuration.stl;
        }
        if (ndkVersion == null) {
            ndkVersion = configuration.ndkVersion;
        }
    }

    private void run() throws PrefabException, IOException {
        if (buildSystem == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing required option: '--build-system'");
        }
        if (output == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing required option: '--output'");
        }
        BuildSystemProvider provider = BuildSystemRegistry.find(buildSystem);
        if (provider == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), String.format(
                    "Unsupported build system '%s'. Expected one of %s", buildSystem, BuildSystemRegistry.getIdentifiers()));
        }

        List<PlatformIdentity> requirements = PlatformRequirements.create(platform, abis, osVersion, stl, ndkVersion);
        List<Package> packages = loadPackages();
        validateDependencies(packages);

        BuildSystem integration = provider.create(output, packages);
        integration.generate(requirements);
    }

    private List<Package> loadPackages() throws PrefabException {
        Set<Path> uniquePaths = new LinkedHashSet<>();
        for (Path path : packagePaths) {
            uniquePaths.add(path.toAbsolutePath().normalize());
        }

        Map<String, Package> seen = new HashMap<>();
        List<Package> packages = new ArrayList<>();
        for (Path path : uniquePaths) {
            Package pkg = new Package(path);
            Package existing = seen.get(pkg.getName());
            if (existing != null) {
                throw new DuplicatePackageException(pkg, existing);
            }
            seen.put(pkg.getName(), pkg);
            packages.add(pkg);
        }
        return packages;
    }

    private static void validateDependencies(List<Package> packages) throws UnknownDependencyException {
        Set<String> known = new HashSet<>();
        for (Package pkg : packages) {
            known.add(pkg.getName());
        }
        for (Package pkg : packages) {
            for (String dependency : pkg.getDependencies()) {
                if (!known.contains(dependency)) {
                    throw new UnknownDependencyException(pkg, dependency);
                }
            }
        }
    }
}
