package de.bsommerfeld.catalog.cache.backend;

import de.bsommerfeld.catalog.cache.index.CacheKey;
import de.bsommerfeld.catalog.cache.index.CachedPackage;
import de.bsommerfeld.catalog.core.model.Bundle;
import de.bsommerfeld.catalog.core.query.BundleSink;
import de.bsommerfeld.catalog.core.util.HashUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Cache backend of plain JSON files.
 *
 * <pre>
 * &lt;dir&gt;/cache/packages.json                      package index
 * &lt;dir&gt;/cache/&lt;package&gt;_&lt;channel&gt;_&lt;name&gt;.json   one file per bundle
 * &lt;dir&gt;/digest                                   digest of the last build
 * </pre>
 */
public class PlainBackend extends AbstractCacheBackend {

    public static final String NAME = "plain";

    private static final Logger LOG = LoggerFactory.getLogger(PlainBackend.class);
    private static final String CACHE_DIR = "cache";
    private static final String JSON_SUFFIX = ".json";

    private final Path cacheDir;

    public PlainBackend(Path baseDir) {
        super(baseDir);
        this.cacheDir = baseDir.resolve(CACHE_DIR);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isCachePresent() {
        return Files.isDirectory(cacheDir) && Files.isRegularFile(baseDir.resolve(DIGEST_FILE));
    }

    @Override
    public void init() throws IOException {
        deleteRecursively(cacheDir);
        Files.deleteIfExists(baseDir.resolve(DIGEST_FILE));
        Files.createDirectories(cacheDir);
        LOG.debug("Initialized plain cache directory {}", cacheDir);
    }

    @Override
    public void open() throws IOException {
        Files.createDirectories(cacheDir);
    }

    @Override
    public void close() {
        // no handles held between calls
    }

    @Override
    public Map<String, CachedPackage> getPackageIndex() throws IOException {
        Path file = cacheDir.resolve(PACKAGE_INDEX);
        if (!Files.isRegularFile(file)) {
            throw new IOException("package index not found in " + cacheDir);
        }
        return decodeIndex(Files.readAllBytes(file));
    }

    @Override
    public void putPackageIndex(Map<String, CachedPackage> index) throws IOException {
        Files.write(cacheDir.resolve(PACKAGE_INDEX), encodeIndex(index));
    }

    @Override
    public Bundle getBundle(CacheKey key) throws IOException {
        Path file = bundleFile(key);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        return JSON.readValue(file.toFile(), Bundle.class);
    }

    @Override
    public void putBundle(CacheKey key, Bundle bundle) throws IOException {
        Files.write(bundleFile(key), JSON.writeValueAsBytes(bundle));
    }

    @Override
    public void sendBundles(BundleSink sink) throws IOException {
        for (Path file : cacheFiles()) {
            if (!file.getFileName().toString().equals(PACKAGE_INDEX)) {
                sink.send(JSON.readValue(file.toFile(), Bundle.class));
            }
        }
    }

    private Path bundleFile(CacheKey key) {
        return cacheDir.resolve(key.packageName() + "_" + key.channelName() + "_" + key.name() + JSON_SUFFIX);
    }

    private List<Path> cacheFiles() throws IOException {
        try (Stream<Path> listing = Files.list(cacheDir)) {
            return listing.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
    }

    @Override
    public String getDigest() throws IOException {
        return readDigest(baseDir.resolve(DIGEST_FILE));
    }

    @Override
    public void putDigest(String digest) throws IOException {
        writeDigest(baseDir.resolve(DIGEST_FILE), digest);
    }

    /** Source content first, then the name and bytes of every cache file. */
    @Override
    public String computeDigest(Path source) throws IOException {
        MessageDigest digest = HashUtil.newDigest();
        digestSource(digest, source);
        for (Path file : cacheFiles()) {
            HashUtil.update(digest, file.getFileName().toString());
            HashUtil.update(digest, file);
        }
        return HashUtil.hex(digest);
    }
}
