package de.bsommerfeld.catalog.core.error;

/**
 * Thrown when a bundle path is not known to the store.
 */
public class BundleImageNotFoundException extends NotFoundException {

    private final String bundlePath;

    public BundleImageNotFoundException(String bundlePath) {
        super("bundle image " + bundlePath + " not found in database");
        this.bundlePath = bundlePath;
    }

    public String getBundlePath() {
        return bundlePath;
    }
}
