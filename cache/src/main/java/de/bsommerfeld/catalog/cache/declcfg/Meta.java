package de.bsommerfeld.catalog.cache.declcfg;

import java.nio.charset.StandardCharsets;

/**
 * One object of the declarative source catalog, kept as its compact JSON
 * encoding together with the routing fields every schema shares.
 *
 * @param schema      value of the root {@code schema} field
 * @param packageName owning package; for {@code olm.package} objects this is
 *                    the object's own name
 * @param name        object name, {@code ""} if absent
 * @param blob        compact JSON encoding of the whole object
 */
public record Meta(String schema, String packageName, String name, byte[] blob) {

    public static final String SCHEMA_PACKAGE = "olm.package";
    public static final String SCHEMA_CHANNEL = "olm.channel";
    public static final String SCHEMA_BUNDLE = "olm.bundle";

    public String json() {
        return new String(blob, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "Meta[schema=" + schema + ", package=" + packageName + ", name=" + name + "]";
    }
}
