package de.bsommerfeld.catalog.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL from classpath resources.
 *
 * <p>
 * Single statements live under {@code sql/} and follow the naming convention
 * {@code sql/<operation>-<entity>.sql}, e.g. {@code insert-channel-entry.sql}
 * or {@code select-bundle-that-replaces.sql}. Multi-statement scripts (the
 * schema migrations) are split into individual statements by
 * {@link #script(String)}.
 *
 * <p>
 * Each resource is read once and cached for the lifetime of the JVM.
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the statement from {@code sql/<name>.sql}, trimmed.
     *
     * @param name the file stem without path prefix or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent("sql/" + name + ".sql", SqlLoader::readResource);
    }

    /**
     * Returns the statements of a script resource (full classpath path),
     * split on semicolons that end a line. Blank fragments are dropped.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static List<String> script(String path) {
        String content = CACHE.computeIfAbsent(path, SqlLoader::readResource);
        List<String> statements = new ArrayList<>();
        for (String sql : content.split(";\\s*(\\r?\\n|$)")) {
            if (!sql.isBlank()) {
                statements.add(sql.trim());
            }
        }
        return statements;
    }

    private static String readResource(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
