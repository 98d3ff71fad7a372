package de.bsommerfeld.catalog.cache.backend;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import de.bsommerfeld.catalog.cache.declcfg.CatalogWalker;
import de.bsommerfeld.catalog.cache.index.CachedPackage;
import de.bsommerfeld.catalog.core.util.HashUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.Map;
import java.util.TreeMap;

/**
 * Shared plumbing of the cache backends: package index encoding, digest
 * files and the source half of the digest.
 */
abstract class AbstractCacheBackend implements CacheBackend {

    static final String PACKAGE_INDEX = "packages.json";
    static final String DIGEST_FILE = "digest";

    protected static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private static final TypeReference<TreeMap<String, CachedPackage>> INDEX_TYPE = new TypeReference<>() {
    };

    protected final Path baseDir;
    private final CatalogWalker walker = new CatalogWalker();

    protected AbstractCacheBackend(Path baseDir) {
        this.baseDir = baseDir;
    }

    protected static byte[] encodeIndex(Map<String, CachedPackage> index) throws IOException {
        return JSON.writeValueAsBytes(new TreeMap<>(index));
    }

    protected static Map<String, CachedPackage> decodeIndex(byte[] data) throws IOException {
        return JSON.readValue(data, INDEX_TYPE);
    }

    /**
     * Folds every content file of the source catalog into {@code digest}, as
     * its path relative to {@code source} followed by its bytes.
     */
    protected void digestSource(MessageDigest digest, Path source) throws IOException {
        for (Path file : walker.files(source)) {
            HashUtil.update(digest, source.relativize(file).toString().replace('\\', '/'));
            HashUtil.update(digest, Files.readAllBytes(file));
        }
    }

    protected static String readDigest(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            return "";
        }
        return Files.readString(file, StandardCharsets.UTF_8).trim();
    }

    protected static void writeDigest(Path file, String digest) throws IOException {
        Files.writeString(file, digest, StandardCharsets.UTF_8);
    }

    /** Deletes {@code path} and everything below it; absent paths are fine. */
    protected static void deleteRecursively(Path path) throws IOException {
        if (Files.exists(path)) {
            MoreFiles.deleteRecursively(path, RecursiveDeleteOption.ALLOW_INSECURE);
        }
    }
}
