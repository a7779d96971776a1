package com.defold.prefab.cli.cmake;

import com.defold.prefab.LibraryReference;
import com.defold.prefab.LibraryVariant;
import com.defold.prefab.Module;
import com.defold.prefab.Package;
import com.defold.prefab.PrefabException;
import com.defold.prefab.buildsystem.AbstractBuildSystem;
import com.defold.prefab.cli.TemplateExecutor;
import com.defold.prefab.platform.PlatformIdentity;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a CMake package config file per package, for use with {@code find_package}.
 *
 * CMake config files describe a single target, so only one requirement is supported per output directory.
 */
public class CMakeBuildSystem extends AbstractBuildSystem {
    private static final Logger LOGGER = LoggerFactory.getLogger(CMakeBuildSystem.class);

    private final TemplateExecutor templateExecutor = new TemplateExecutor();

    public CMakeBuildSystem(Path outputDirectory, List<Package> packages) {
        super(outputDirectory, packages);
    }

    @Override
    public void generate(List<PlatformIdentity> requirements) throws PrefabException, IOException {
        if (requirements.size() != 1) {
            throw new UnsupportedOperationException("CMake cannot generate multiple targets to a single directory");
        }
        PlatformIdentity requirement = requirements.get(0);

        prepareOutputDirectory();
        for (Package pkg : packages) {
            generatePackage(pkg, requirement);
        }
    }

    private void generatePackage(Package pkg, PlatformIdentity requirement) throws PrefabException, IOException {
        StringBuilder config = new StringBuilder();
        List<String> dependencies = new ArrayList<>(pkg.getDependencies());
        dependencies.sort(Comparator.naturalOrder());
        for (String dependency : dependencies) {
            config.append(templateExecutor.execute("cmake/dependency", "dependency", dependency));
        }
        if (!dependencies.isEmpty()) {
            config.append('\n');
        }

        List<Module> modules = new ArrayList<>(pkg.getModules());
        modules.sort(Comparator.comparing(Module::getName));
        for (Module module : modules) {
            config.append(emitOrSkip(module, requirement, this::emitModule));
        }

        File configFile = outputDirectory.resolve(pkg.getName() + "-config.cmake").toFile();
        FileUtils.writeStringToFile(configFile, config.toString(), StandardCharsets.UTF_8);
        LOGGER.info("Generated {}", configFile);

        if (pkg.getVersion() != null) {
            File versionFile = outputDirectory.resolve(pkg.getName() + "-config-version.cmake").toFile();
            FileUtils.writeStringToFile(versionFile,
                    templateExecutor.execute("cmake/config-version", "version", pkg.getVersion()),
                    StandardCharsets.UTF_8);
            LOGGER.info("Generated {}", versionFile);
        }
    }

    private String emitModule(Module module, PlatformIdentity requirement) throws PrefabException {
        Map<String, Object> context = new HashMap<>();
        context.put("target", targetName(module.getPackage().getName(), module.getName()));
        context.put("linkLibraries", String.join(";", linkLibraries(module, requirement)));

        if (module.isHeaderOnly()) {
            context.put("includePath", toSlashPath(module.getIncludePath()));
            return templateExecutor.execute("cmake/interface-module", context);
        }

        LibraryVariant library = module.resolveLibrary(requirement);
        context.put("libraryType", library.isStatic() ? "STATIC" : "SHARED");
        context.put("location", toSlashPath(library.getPath()));
        context.put("includePath", toSlashPath(library.getIncludePath()));
        return templateExecutor.execute("cmake/imported-module", context);
    }

    /**
     * Literal flags first, then modules of the same package, then modules of other packages.
     */
    private static List<String> linkLibraries(Module module, PlatformIdentity requirement) {
        List<LibraryReference> references = module.getExportLibraries(requirement.getFactory());
        List<String> literals = new ArrayList<>();
        List<String> locals = new ArrayList<>();
        List<String> externals = new ArrayList<>();
        for (LibraryReference reference : references) {
            if (reference instanceof LibraryReference.Literal) {
                literals.add(((LibraryReference.Literal) reference).getArg());
            } else if (reference instanceof LibraryReference.Local) {
                locals.add(targetName(module.getPackage().getName(), ((LibraryReference.Local) reference).getName()));
            } else {
                LibraryReference.External external = (LibraryReference.External) reference;
                externals.add(targetName(external.getPackage(), external.getModule()));
            }
        }
        List<String> result = new ArrayList<>(literals);
        result.addAll(locals);
        result.addAll(externals);
        return result;
    }

    private static String targetName(String packageName, String moduleName) {
        return packageName + "::" + moduleName;
    }
}
