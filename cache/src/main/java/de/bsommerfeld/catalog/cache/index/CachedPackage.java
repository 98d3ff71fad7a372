package de.bsommerfeld.catalog.cache.index;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Package summary persisted as one entry of the package index.
 */
public record CachedPackage(String name, String description, String defaultChannel,
        Map<String, CachedChannel> channels) {

    public CachedPackage {
        description = description == null ? "" : description;
        defaultChannel = defaultChannel == null ? "" : defaultChannel;
        channels = channels == null ? Map.of() : Collections.unmodifiableSortedMap(new TreeMap<>(channels));
    }
}
