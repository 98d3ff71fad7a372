package de.bsommerfeld.catalog.core.error;

/**
 * The stored cache digest does not match the digest computed from the live
 * source. Recoverable by rebuilding the cache.
 */
public class IntegrityException extends CatalogException {

    private final String storedDigest;
    private final String computedDigest;

    public IntegrityException(String storedDigest, String computedDigest) {
        super(String.format("cache requires rebuild: cache reports digest as \"%s\", but computed digest is \"%s\"",
                storedDigest, computedDigest));
        this.storedDigest = storedDigest;
        this.computedDigest = computedDigest;
    }

    public String getStoredDigest() {
        return storedDigest;
    }

    public String getComputedDigest() {
        return computedDigest;
    }
}
