package de.bsommerfeld.catalog.cache.index;

/**
 * Storage key of a bundle: one bundle per channel membership.
 */
public record CacheKey(String packageName, String channelName, String name) {

    @Override
    public String toString() {
        return packageName + "/" + channelName + "/" + name;
    }
}
