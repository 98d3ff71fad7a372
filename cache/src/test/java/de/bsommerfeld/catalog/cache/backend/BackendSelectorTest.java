package de.bsommerfeld.catalog.cache.backend;

import de.bsommerfeld.catalog.core.config.CacheConfig;
import de.bsommerfeld.catalog.core.error.CacheException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BackendSelectorTest {

    @TempDir
    Path dir;

    @Test
    void select_shouldPreferCompactForEmptyDirectory() throws Exception {
        assertEquals(CompactBackend.NAME, BackendSelector.select(dir, CacheConfig.Backend.AUTO).name());
    }

    @Test
    void select_shouldPreferCompactForMissingDirectory() throws Exception {
        assertEquals(CompactBackend.NAME,
                BackendSelector.select(dir.resolve("missing"), CacheConfig.Backend.AUTO).name());
    }

    @Test
    void select_shouldDetectPlainLayout() throws Exception {
        Files.createDirectories(dir.resolve("cache"));
        Files.writeString(dir.resolve("digest"), "abc");

        assertEquals(PlainBackend.NAME, BackendSelector.select(dir, CacheConfig.Backend.AUTO).name());
    }

    @Test
    void select_shouldDetectCompactLayout() throws Exception {
        Files.createDirectories(dir.resolve("compact.v1"));

        assertEquals(CompactBackend.NAME, BackendSelector.select(dir, CacheConfig.Backend.AUTO).name());
    }

    @Test
    void select_shouldRejectUnexpectedContents() throws Exception {
        Files.writeString(dir.resolve("notes.txt"), "hello");
        Files.createDirectories(dir.resolve("cache"));

        CacheException e = assertThrows(CacheException.class,
                () -> BackendSelector.select(dir, CacheConfig.Backend.AUTO));
        assertEquals("cache directory " + dir + " has unexpected contents: cache, notes.txt", e.getMessage());
    }

    @Test
    void select_shouldHonorForcedBackend() throws Exception {
        Files.writeString(dir.resolve("notes.txt"), "hello");

        assertEquals(PlainBackend.NAME, BackendSelector.select(dir, CacheConfig.Backend.PLAIN).name());
        assertEquals(CompactBackend.NAME, BackendSelector.select(dir, CacheConfig.Backend.COMPACT).name());
    }
}
