package com.defold.prefab.cli.ndkbuild;

import com.defold.prefab.LibraryReference;
import com.defold.prefab.LibraryVariant;
import com.defold.prefab.Module;
import com.defold.prefab.Package;
import com.defold.prefab.PrefabException;
import com.defold.prefab.buildsystem.AbstractBuildSystem;
import com.defold.prefab.cli.TemplateExecutor;
import com.defold.prefab.platform.Android;
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
 * Writes an Android.mk per package, imported with {@code $(call import-module,prefab/<package>)}.
 */
public class NdkBuildSystem extends AbstractBuildSystem {
    private static final Logger LOGGER = LoggerFactory.getLogger(NdkBuildSystem.class);

    private final TemplateExecutor templateExecutor = new TemplateExecutor();

    public NdkBuildSystem(Path outputDirectory, List<Package> packages) {
        super(outputDirectory, packages);
    }

    @Override
    public void generate(List<PlatformIdentity> requirements) throws PrefabException, IOException {
        for (PlatformIdentity requirement : requirements) {
            if (!(requirement instanceof Android)) {
                throw new UnsupportedOperationException("ndk-build only supports Android targets");
            }
        }
        checkModuleNamesAreUnique();

        prepareOutputDirectory();
        for (Package pkg : packages) {
            generatePackage(pkg, requirements);
        }
    }

    private void checkModuleNamesAreUnique() throws DuplicateModuleNameException {
        Map<String, Module> seen = new HashMap<>();
        for (Package pkg : packages) {
            for (Module module : pkg.getModules()) {
                Module existing = seen.get(module.getName());
                if (existing != null) {
                    throw new DuplicateModuleNameException(module, existing);
                }
                seen.put(module.getName(), module);
            }
        }
    }

    private void generatePackage(Package pkg, List<PlatformIdentity> requirements) throws PrefabException, IOException {
        StringBuilder androidMk = new StringBuilder();
        androidMk.append(templateExecutor.execute("ndkbuild/android-mk-header", new HashMap<>()));

        List<Module> modules = new ArrayList<>(pkg.getModules());
        modules.sort(Comparator.comparing(Module::getName));
        for (PlatformIdentity requirement : requirements) {
            String abi = ((Android) requirement).getAbi().getTargetArchAbi();
            androidMk.append(templateExecutor.execute("ndkbuild/abi-begin", "abi", abi));
            for (Module module : modules) {
                androidMk.append(emitOrSkip(module, requirement, this::emitModule));
            }
            androidMk.append(templateExecutor.execute("ndkbuild/abi-end", "abi", abi));
        }

        List<String> dependencies = new ArrayList<>(pkg.getDependencies());
        dependencies.sort(Comparator.naturalOrder());
        for (String dependency : dependencies) {
            androidMk.append(templateExecutor.execute("ndkbuild/import-module", "dependency", dependency));
        }

        File file = outputDirectory.resolve(pkg.getName()).resolve("Android.mk").toFile();
        FileUtils.writeStringToFile(file, androidMk.toString(), StandardCharsets.UTF_8);
        LOGGER.info("Generated {}", file);
    }

    private String emitModule(Module module, PlatformIdentity requirement) throws PrefabException {
        List<String> ldLibs = new ArrayList<>();
        List<String> sharedLibraries = new ArrayList<>();
        List<String> staticLibraries = new ArrayList<>();
        for (LibraryReference reference : module.getExportLibraries(requirement.getFactory())) {
            if (reference instanceof LibraryReference.Literal) {
                ldLibs.add(((LibraryReference.Literal) reference).getArg());
                continue;
            }
            Module target = referenceResolver.findModule(reference, module);
            switch (referenceResolver.linkageOf(target, requirement)) {
                case SHARED:
                    sharedLibraries.add(target.getName());
                    break;
                case STATIC:
                case HEADER_ONLY:
                    // ndk-build header only modules are static libraries without sources.
                    staticLibraries.add(target.getName());
                    break;
                default:
                    throw new IllegalStateException();
            }
        }

        Map<String, Object> context = new HashMap<>();
        context.put("name", module.getName());
        context.put("sharedLibraries", exportList(sharedLibraries));
        context.put("staticLibraries", exportList(staticLibraries));
        context.put("ldLibs", exportList(ldLibs));

        if (module.isHeaderOnly()) {
            context.put("includePath", toSlashPath(module.getIncludePath()));
            return templateExecutor.execute("ndkbuild/header-only-module", context);
        }

        LibraryVariant library = module.resolveLibrary(requirement);
        context.put("library", toSlashPath(library.getPath()));
        context.put("includePath", toSlashPath(library.getIncludePath()));
        context.put("prebuiltType", library.isStatic() ? "PREBUILT_STATIC_LIBRARY" : "PREBUILT_SHARED_LIBRARY");
        return templateExecutor.execute("ndkbuild/prebuilt-module", context);
    }

    /**
     * @return The values each preceded by a space, so that {@code VAR :=} is followed by nothing when empty
     */
    private static String exportList(List<String> values) {
        StringBuilder result = new StringBuilder();
        for (String value : values) {
            result.append(' ').append(value);
        }
        return result.toString();
    }
}
