package de.bsommerfeld.catalog.core.graph;

/**
 * Identity of a node in a channel graph. Synthetic skip targets that never
 * shipped as real bundles carry only a CSV name.
 */
public record BundleKey(String bundlePath, String version, String csvName) {

    public BundleKey {
        bundlePath = bundlePath == null ? "" : bundlePath;
        version = version == null ? "" : version;
        csvName = csvName == null ? "" : csvName;
    }

    public boolean isEmpty() {
        return bundlePath.isEmpty() && version.isEmpty() && csvName.isEmpty();
    }

    @Override
    public String toString() {
        return csvName + "@" + version;
    }
}
