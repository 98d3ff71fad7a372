package de.bsommerfeld.catalog.cache.backend;

import de.bsommerfeld.catalog.cache.index.CacheKey;
import de.bsommerfeld.catalog.cache.index.CachedPackage;
import de.bsommerfeld.catalog.core.model.Bundle;
import de.bsommerfeld.catalog.core.query.BundleSink;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Persistent storage of a built cache. Implementations own one directory and
 * must accept concurrent {@link #putBundle} calls while a build runs.
 */
public interface CacheBackend extends Closeable {

    String name();

    /** Whether the cache directory holds this backend's on-disk signature. */
    boolean isCachePresent();

    /** Wipes any existing content and prepares an empty store. */
    void init() throws IOException;

    void open() throws IOException;

    @Override
    void close() throws IOException;

    Map<String, CachedPackage> getPackageIndex() throws IOException;

    void putPackageIndex(Map<String, CachedPackage> index) throws IOException;

    /** The stored bundle, or {@code null} if the key is unknown. */
    Bundle getBundle(CacheKey key) throws IOException;

    void putBundle(CacheKey key, Bundle bundle) throws IOException;

    /** Streams every stored bundle once, in a stable backend-defined order. */
    void sendBundles(BundleSink sink) throws IOException;

    /** The digest recorded by the last build, {@code ""} if none. */
    String getDigest() throws IOException;

    /** Digest over the source catalog at {@code source} and the stored content. */
    String computeDigest(Path source) throws IOException;

    void putDigest(String digest) throws IOException;
}
