package de.bsommerfeld.catalog.cache.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import de.bsommerfeld.catalog.cache.index.CacheKey;
import de.bsommerfeld.catalog.cache.index.CachedPackage;
import de.bsommerfeld.catalog.core.model.Bundle;
import de.bsommerfeld.catalog.core.query.BundleSink;
import de.bsommerfeld.catalog.core.util.HashUtil;
import de.bsommerfeld.catalog.db.SqliteDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;

/**
 * Cache backend keeping everything in one embedded key-value table.
 *
 * <pre>
 * &lt;dir&gt;/compact.v1/db       SQLite file, table kv(key, value)
 * &lt;dir&gt;/compact.v1/digest   digest of the last build
 * </pre>
 *
 * Keys are {@code packages.json} (JSON package index) and
 * {@code bundles/<package>/<channel>/<name>} (CBOR-encoded bundles). All
 * access goes through a single connection guarded by this instance.
 */
public class CompactBackend extends AbstractCacheBackend {

    public static final String NAME = "compact.v1";

    private static final Logger LOG = LoggerFactory.getLogger(CompactBackend.class);
    private static final ObjectMapper CBOR = new ObjectMapper(new CBORFactory());
    private static final String BUNDLE_PREFIX = "bundles/";

    private final Path storeDir;
    private Connection connection;

    public CompactBackend(Path baseDir) {
        super(baseDir);
        this.storeDir = baseDir.resolve(NAME);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isCachePresent() {
        return Files.isDirectory(storeDir);
    }

    @Override
    public synchronized void init() throws IOException {
        close();
        deleteRecursively(storeDir);
        open();
        LOG.debug("Initialized compact cache store at {}", storeDir);
    }

    @Override
    public synchronized void open() throws IOException {
        if (connection != null) {
            return;
        }
        Files.createDirectories(storeDir);
        try {
            connection = new SqliteDatabase(storeDir.resolve("db")).getConnection();
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("CREATE TABLE IF NOT EXISTS kv (key TEXT PRIMARY KEY, value BLOB NOT NULL)");
            }
        } catch (SQLException e) {
            connection = null;
            throw new IOException("Failed to open compact cache store " + storeDir, e);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            throw new IOException("Failed to close compact cache store " + storeDir, e);
        } finally {
            connection = null;
        }
    }

    // =====================================================================
    // Package index and bundles
    // =====================================================================

    @Override
    public Map<String, CachedPackage> getPackageIndex() throws IOException {
        byte[] data = get(PACKAGE_INDEX);
        if (data == null) {
            throw new IOException("package index not found in " + storeDir);
        }
        return decodeIndex(data);
    }

    @Override
    public void putPackageIndex(Map<String, CachedPackage> index) throws IOException {
        put(PACKAGE_INDEX, encodeIndex(index));
    }

    @Override
    public Bundle getBundle(CacheKey key) throws IOException {
        byte[] data = get(bundleKey(key));
        return data == null ? null : CBOR.readValue(data, Bundle.class);
    }

    @Override
    public void putBundle(CacheKey key, Bundle bundle) throws IOException {
        put(bundleKey(key), CBOR.writeValueAsBytes(bundle));
    }

    @Override
    public synchronized void sendBundles(BundleSink sink) throws IOException {
        try (PreparedStatement stmt = requireConnection()
                .prepareStatement("SELECT value FROM kv WHERE key LIKE ? ORDER BY key")) {
            stmt.setString(1, BUNDLE_PREFIX + "%");
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    sink.send(CBOR.readValue(rs.getBytes(1), Bundle.class));
                }
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list bundles", e);
        }
    }

    private static String bundleKey(CacheKey key) {
        return BUNDLE_PREFIX + key.packageName() + "/" + key.channelName() + "/" + key.name();
    }

    // =====================================================================
    // Digest
    // =====================================================================

    @Override
    public String getDigest() throws IOException {
        return readDigest(storeDir.resolve(DIGEST_FILE));
    }

    @Override
    public void putDigest(String digest) throws IOException {
        writeDigest(storeDir.resolve(DIGEST_FILE), digest);
    }

    /**
     * Source content first, then every key and value of the store in key
     * order, so the result does not depend on insertion order.
     */
    @Override
    public synchronized String computeDigest(Path source) throws IOException {
        MessageDigest digest = HashUtil.newDigest();
        digestSource(digest, source);
        try (Statement stmt = requireConnection().createStatement();
                ResultSet rs = stmt.executeQuery("SELECT key, value FROM kv ORDER BY key")) {
            while (rs.next()) {
                HashUtil.update(digest, rs.getString(1));
                HashUtil.update(digest, rs.getBytes(2));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to digest compact cache store", e);
        }
        return HashUtil.hex(digest);
    }

    // =====================================================================
    // Key-value access
    // =====================================================================

    private synchronized byte[] get(String key) throws IOException {
        try (PreparedStatement stmt = requireConnection().prepareStatement("SELECT value FROM kv WHERE key = ?")) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getBytes(1) : null;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read key " + key, e);
        }
    }

    private synchronized void put(String key, byte[] value) throws IOException {
        try (PreparedStatement stmt = requireConnection()
                .prepareStatement("INSERT OR REPLACE INTO kv (key, value) VALUES (?, ?)")) {
            stmt.setString(1, key);
            stmt.setBytes(2, value);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to write key " + key, e);
        }
    }

    private Connection requireConnection() throws IOException {
        if (connection == null) {
            throw new IOException("compact cache store " + storeDir + " is not open");
        }
        return connection;
    }
}
