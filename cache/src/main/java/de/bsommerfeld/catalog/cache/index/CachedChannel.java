package de.bsommerfeld.catalog.cache.index;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A channel of the package index with its head and members by name.
 */
public record CachedChannel(String name, String head, Map<String, CachedBundle> bundles) {

    public CachedChannel {
        bundles = bundles == null ? Map.of() : Collections.unmodifiableSortedMap(new TreeMap<>(bundles));
    }
}
