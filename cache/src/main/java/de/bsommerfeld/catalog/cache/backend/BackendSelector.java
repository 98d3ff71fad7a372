package de.bsommerfeld.catalog.cache.backend;

import de.bsommerfeld.catalog.core.config.CacheConfig;
import de.bsommerfeld.catalog.core.error.CacheException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Picks the backend for a cache directory. An absent or empty directory gets
 * the compact backend; otherwise the directory must carry the signature of
 * one of the known backends.
 */
public final class BackendSelector {

    private static final Logger LOG = LoggerFactory.getLogger(BackendSelector.class);

    private BackendSelector() {
    }

    public static CacheBackend select(Path dir, CacheConfig.Backend choice) throws CacheException {
        switch (choice) {
            case COMPACT:
                return new CompactBackend(dir);
            case PLAIN:
                return new PlainBackend(dir);
            default:
                return detect(dir);
        }
    }

    static CacheBackend detect(Path dir) throws CacheException {
        List<String> contents = contents(dir);
        if (contents.isEmpty()) {
            LOG.debug("Cache directory {} is empty, using {}", dir, CompactBackend.NAME);
            return new CompactBackend(dir);
        }
        for (CacheBackend candidate : List.of(new CompactBackend(dir), new PlainBackend(dir))) {
            if (candidate.isCachePresent()) {
                LOG.debug("Detected {} cache in {}", candidate.name(), dir);
                return candidate;
            }
        }
        throw new CacheException(String.format("cache directory %s has unexpected contents: %s",
                dir, String.join(", ", contents)));
    }

    private static List<String> contents(Path dir) throws CacheException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> listing = Files.list(dir)) {
            return listing.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new CacheException("Failed to inspect cache directory " + dir, e);
        }
    }
}
