package de.bsommerfeld.scratchdb.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @Test
    void getAppDataDir_shouldBeAbsoluteAndContainAppName() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.isAbsolute());
        assertTrue(dir.toString().contains("test-app"));
    }

    @Test
    void getAppDataDir_differentNames_shouldProduceDifferentPaths() {
        assertNotEquals(StorageUtils.getAppDataDir("app-one"), StorageUtils.getAppDataDir("app-two"));
    }

    @Test
    void getBlobDir_shouldBeSubdirOfAppDataDir() {
        Path appDir = StorageUtils.getAppDataDir("test-app");
        assertEquals(appDir.resolve("blobs"), StorageUtils.getBlobDir("test-app"));
    }
}
