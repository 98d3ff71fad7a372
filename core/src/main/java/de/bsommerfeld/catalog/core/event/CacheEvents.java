package de.bsommerfeld.catalog.core.event;

import java.time.Duration;

/**
 * Lifecycle events posted by the cache engine.
 */
public class CacheEvents {

    public record BuildStarted(String backend, String source) {
    }

    public record BuildCompleted(String backend, int packages, String digest, Duration duration) {
    }

    /**
     * The stored digest no longer matches the source; a rebuild usually
     * follows.
     */
    public record IntegrityMismatch(String storedDigest, String computedDigest) {
    }
}
