package de.bsommerfeld.catalog.db.migration;

import java.util.List;

/**
 * The known schema migrations, in application order.
 */
public final class Migrations {

    private static final List<Migration> ALL = List.of(
            new Migration(0, "initial-schema"),
            new Migration(1, "properties"),
            new Migration(2, "deprecated"),
            new Migration(3, "substitutes-for"));

    private Migrations() {
    }

    public static List<Migration> all() {
        return ALL;
    }

    public static int latest() {
        return ALL.get(ALL.size() - 1).id();
    }
}
