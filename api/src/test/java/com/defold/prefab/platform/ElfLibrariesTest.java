package com.defold.prefab.platform;

import com.defold.prefab.PrefabException;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ElfLibrariesTest {

    private Path directory;

    @BeforeEach
    public void setUp() throws Exception {
        directory = Files.createTempDirectory("elf-libraries-test");
    }

    @AfterEach
    public void tearDown() throws Exception {
        FileUtils.deleteDirectory(directory.toFile());
    }

    @Test
    public void testFindsSingleLibrary() throws Exception {
        Files.createFile(directory.resolve("libfoo.a"));
        Path found = ElfLibraries.find(directory, "libfoo");
        assertEquals(directory.resolve("libfoo.a"), found);
        assertTrue(ElfLibraries.isStaticArchive(found));
    }

    @Test
    public void testBothKindsIsAnError() throws Exception {
        Files.createFile(directory.resolve("libfoo.a"));
        Files.createFile(directory.resolve("libfoo.so"));
        PrefabException e = assertThrows(PrefabException.class, () -> ElfLibraries.find(directory, "libfoo"));
        assertTrue(e.getMessage().startsWith("Prebuilt directory contains multiple library artifacts"));
    }

    @Test
    public void testNoLibraryIsAnError() throws Exception {
        Files.createFile(directory.resolve("libbar.so"));
        PrefabException e = assertThrows(PrefabException.class, () -> ElfLibraries.find(directory, "libfoo"));
        assertTrue(e.getMessage().startsWith("Prebuilt directory contains no library artifacts"));
    }

    @Test
    public void testIsStaticArchive() {
        assertTrue(ElfLibraries.isStaticArchive(Paths.get("libs", "libfoo.a")));
        assertFalse(ElfLibraries.isStaticArchive(Paths.get("libs", "libfoo.so")));
        assertFalse(ElfLibraries.isStaticArchive(Paths.get("libs", "libfoo.a.so")));
    }
}
