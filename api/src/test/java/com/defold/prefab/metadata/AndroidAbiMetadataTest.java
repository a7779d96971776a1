package com.defold.prefab.metadata;

import com.defold.prefab.Module;
import com.defold.prefab.PrefabException;
import com.defold.prefab.SchemaVersion;
import com.defold.prefab.platform.PlatformFactory;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class AndroidAbiMetadataTest {

    private Path directory;
    private Module module;

    @BeforeEach
    public void setUp() throws Exception {
        directory = Files.createTempDirectory("android-abi-metadata-test");
        module = mock(Module.class);
        when(module.getLibraryName(any(PlatformFactory.class))).thenReturn("libfoo");
    }

    @AfterEach
    public void tearDown() throws Exception {
        FileUtils.deleteDirectory(directory.toFile());
    }

    private void writeAbiJson(String json) throws Exception {
        FileUtils.writeStringToFile(directory.resolve("abi.json").toFile(), json, StandardCharsets.UTF_8);
    }

    @Test
    public void testV1StaticIsInferredFromArchive() throws Exception {
        writeAbiJson("{\"abi\": \"arm64-v8a\", \"api\": 21, \"ndk\": 21, \"stl\": \"c++_static\"}");
        Files.createFile(directory.resolve("libfoo.a"));

        AndroidAbiMetadataV2 metadata = SchemaMigrations.ANDROID_ABI.loadAndMigrate(SchemaVersion.V1, directory, module);
        assertEquals("arm64-v8a", metadata.getAbi());
        assertEquals(21, metadata.getApi());
        assertEquals(21, metadata.getNdk());
        assertEquals("c++_static", metadata.getStl());
        assertTrue(metadata.isStatic());
    }

    @Test
    public void testV1SharedIsInferredFromSharedObject() throws Exception {
        writeAbiJson("{\"abi\": \"x86\", \"api\": 16, \"ndk\": 19, \"stl\": \"c++_shared\"}");
        Files.createFile(directory.resolve("libfoo.so"));

        assertFalse(SchemaMigrations.ANDROID_ABI.loadAndMigrate(SchemaVersion.V1, directory, module).isStatic());
    }

    @Test
    public void testV1RequiresExactlyOneLibrary() throws Exception {
        writeAbiJson("{\"abi\": \"x86\", \"api\": 16, \"ndk\": 19, \"stl\": \"c++_shared\"}");
        assertThrows(PrefabException.class,
                () -> SchemaMigrations.ANDROID_ABI.loadAndMigrate(SchemaVersion.V1, directory, module));

        Files.createFile(directory.resolve("libfoo.a"));
        Files.createFile(directory.resolve("libfoo.so"));
        assertThrows(PrefabException.class,
                () -> SchemaMigrations.ANDROID_ABI.loadAndMigrate(SchemaVersion.V1, directory, module));
    }

    @Test
    public void testV1RejectsStaticKey() throws Exception {
        writeAbiJson("{\"abi\": \"x86\", \"api\": 16, \"ndk\": 19, \"stl\": \"c++_shared\", \"static\": true}");
        Files.createFile(directory.resolve("libfoo.a"));
        assertThrows(PrefabException.class,
                () -> SchemaMigrations.ANDROID_ABI.loadAndMigrate(SchemaVersion.V1, directory, module));
    }

    @Test
    public void testV2RecordsStaticExplicitly() throws Exception {
        writeAbiJson("{\"abi\": \"x86\", \"api\": 16, \"ndk\": 19, \"stl\": \"c++_shared\", \"static\": true}");
        assertTrue(SchemaMigrations.ANDROID_ABI.loadAndMigrate(SchemaVersion.V2, directory, module).isStatic());

        writeAbiJson("{\"abi\": \"x86\", \"api\": 16, \"ndk\": 19, \"stl\": \"c++_shared\"}");
        assertFalse(SchemaMigrations.ANDROID_ABI.loadAndMigrate(SchemaVersion.V2, directory, module).isStatic());
    }
}
