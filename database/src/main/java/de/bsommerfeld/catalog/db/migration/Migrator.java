package de.bsommerfeld.catalog.db.migration;

import de.bsommerfeld.catalog.core.error.CatalogException;
import de.bsommerfeld.catalog.db.SqlLoader;
import de.bsommerfeld.catalog.db.SqliteDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Moves a catalog database between schema versions.
 *
 * <p>
 * The current version is a single row in {@code schema_migrations}; a fresh
 * database reports {@link #NIL_VERSION}. Each step runs in its own
 * transaction together with the version update, so a failed step leaves the
 * database at the previous version.
 */
public class Migrator {

    public static final int NIL_VERSION = -1;

    private static final Logger LOG = LoggerFactory.getLogger(Migrator.class);

    private final SqliteDatabase db;
    private final List<Migration> migrations;

    public Migrator(SqliteDatabase db) {
        this(db, Migrations.all());
    }

    Migrator(SqliteDatabase db, List<Migration> migrations) {
        for (int i = 1; i < migrations.size(); i++) {
            if (migrations.get(i).id() <= migrations.get(i - 1).id()) {
                throw new IllegalStateException("migration applied out of order: "
                        + migrations.get(i).id() + " after " + migrations.get(i - 1).id());
            }
        }
        this.db = db;
        this.migrations = List.copyOf(migrations);
    }

    public int currentVersion() throws CatalogException {
        try (Connection conn = db.getConnection()) {
            return readVersion(conn);
        } catch (SQLException e) {
            throw new CatalogException("Failed to read schema version", e);
        }
    }

    /** Applies every pending migration. */
    public void migrate() throws CatalogException {
        migrateTo(migrations.isEmpty() ? NIL_VERSION : migrations.get(migrations.size() - 1).id());
    }

    /**
     * Applies up migrations when {@code target} is newer than the current
     * version and down migrations, newest first, when it is older.
     */
    public void migrateTo(int target) throws CatalogException {
        try (Connection conn = db.getConnection()) {
            int current = readVersion(conn);
            int latest = migrations.isEmpty() ? NIL_VERSION : migrations.get(migrations.size() - 1).id();
            if (current > latest) {
                throw new CatalogException("database schema version " + current
                        + " is newer than the latest known migration " + latest);
            }
            if (target > current) {
                for (Migration m : migrations) {
                    if (m.id() > current && m.id() <= target) {
                        apply(conn, m.up(), m.id());
                        LOG.info("Applied migration {} ({})", m.id(), m.name());
                    }
                }
            } else if (target < current) {
                List<Migration> reversed = new ArrayList<>(migrations);
                Collections.reverse(reversed);
                for (Migration m : reversed) {
                    if (m.id() <= current && m.id() > target) {
                        apply(conn, m.down(), previousId(m));
                        LOG.info("Reverted migration {} ({})", m.id(), m.name());
                    }
                }
            }
        } catch (SQLException e) {
            throw new CatalogException("Schema migration failed", e);
        }
    }

    private int previousId(Migration m) {
        int index = migrations.indexOf(m);
        return index == 0 ? NIL_VERSION : migrations.get(index - 1).id();
    }

    private void apply(Connection conn, List<String> statements, int resultingVersion) throws SQLException {
        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
            try (PreparedStatement ps = conn.prepareStatement("UPDATE schema_migrations SET version = ?, timestamp = ?")) {
                ps.setInt(1, resultingVersion);
                ps.setLong(2, System.currentTimeMillis() / 1000);
                ps.executeUpdate();
            }
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private int readVersion(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            for (String sql : SqlLoader.script("migrations/schema-migrations.sql")) {
                stmt.execute(sql);
            }
            try (ResultSet rs = stmt.executeQuery("SELECT version FROM schema_migrations LIMIT 1")) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            stmt.executeUpdate("INSERT INTO schema_migrations (version, timestamp) VALUES (" + NIL_VERSION + ", "
                    + System.currentTimeMillis() / 1000 + ")");
            return NIL_VERSION;
        }
    }
}
