package de.bsommerfeld.catalog.core.error;

/**
 * A deprecation would remove a package's default channel while other
 * channels survive, leaving no sensible default to promote.
 */
public class DeprecationPolicyException extends CatalogException {

    public DeprecationPolicyException(String message) {
        super(message);
    }
}
