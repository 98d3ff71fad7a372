package de.bsommerfeld.catalog.db.migration;

import de.bsommerfeld.catalog.db.SqlLoader;

import java.util.List;

/**
 * One reversible schema step. Scripts live at
 * {@code migrations/<id>-<name>.up.sql} and {@code .down.sql}, with the id
 * zero-padded to three digits.
 */
public record Migration(int id, String name) {

    public List<String> up() {
        return SqlLoader.script(resource("up"));
    }

    public List<String> down() {
        return SqlLoader.script(resource("down"));
    }

    private String resource(String direction) {
        return String.format("migrations/%03d-%s.%s.sql", id, name, direction);
    }
}
