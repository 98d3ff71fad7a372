package de.bsommerfeld.catalog.cache.index;

import java.util.List;

/**
 * Graph identity of a bundle within one channel, as kept in the package
 * index. The full bundle lives in the backend under the matching key.
 */
public record CachedBundle(String packageName, String channelName, String name, String replaces,
        List<String> skips) {

    public CachedBundle {
        replaces = replaces == null ? "" : replaces;
        skips = skips == null ? List.of() : List.copyOf(skips);
    }

    /** Whether this bundle replaces or skips {@code other}. */
    public boolean supersedes(String other) {
        return replaces.equals(other) || skips.contains(other);
    }
}
