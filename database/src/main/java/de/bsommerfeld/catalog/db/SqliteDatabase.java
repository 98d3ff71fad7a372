package de.bsommerfeld.catalog.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Handle on one SQLite catalog file.
 *
 * <p>
 * A new {@link Connection} is opened per operation and closed right after.
 * SQLite serializes writers at the file level, so concurrent callers are
 * ordered by the store's own locking; the busy timeout makes a second writer
 * wait instead of failing immediately.
 */
public class SqliteDatabase {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteDatabase.class);
    private static final String BUSY_TIMEOUT_MILLIS = "10000";

    private final String url;

    public SqliteDatabase(Path file) {
        this.url = "jdbc:sqlite:" + file.toAbsolutePath();
    }

    /**
     * Creates a database in a fresh temporary file that is deleted when the
     * JVM exits.
     */
    public static SqliteDatabase temporary() throws IOException {
        Path file = Files.createTempFile("catalog-", ".db");
        file.toFile().deleteOnExit();
        LOG.info("Using volatile catalog database at {}", file);
        return new SqliteDatabase(file);
    }

    public Connection getConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", BUSY_TIMEOUT_MILLIS);
        return DriverManager.getConnection(url, props);
    }

    public String getUrl() {
        return url;
    }
}
