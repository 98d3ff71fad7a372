package de.bsommerfeld.catalog.db;

import de.bsommerfeld.catalog.core.error.CatalogException;
import de.bsommerfeld.catalog.core.graph.PackageGraph;
import de.bsommerfeld.catalog.core.model.Bundle;
import de.bsommerfeld.catalog.core.model.PackageManifest;

/**
 * Write side of the relational catalog.
 *
 * <p>
 * Every method runs as one transaction. Structural graph errors of individual
 * channels are collected and thrown after the surviving channels have been
 * committed; any other failure rolls the whole operation back.
 */
public interface CatalogLoader {

    void addBundle(Bundle bundle) throws CatalogException;

    /**
     * Replaces the package's channels with the ones declared by
     * {@code manifest} and derives every channel's entries by walking the
     * {@code replaces} chain from its head. The default channel is only
     * recorded if a channel of that name was written.
     */
    void addPackageChannels(PackageManifest manifest) throws CatalogException;

    /** {@link #addBundle} followed by {@link #addPackageChannels}, atomically. */
    void addBundlePackageChannels(PackageManifest manifest, Bundle bundle) throws CatalogException;

    /** Persists the channels of a graph produced by the graph loader. */
    void addPackageGraph(PackageGraph graph) throws CatalogException;

    /**
     * Tombstones the bundle at {@code bundlePath} and truncates the channels
     * it belongs to below it. Fails if the bundle heads a default channel.
     */
    void deprecateBundle(String bundlePath) throws CatalogException;

    void removePackage(String packageName) throws CatalogException;

    /**
     * Deletes every bundle without a channel entry that is not tombstoned.
     *
     * @return the number of bundles removed
     */
    int removeStrandedBundles() throws CatalogException;

    /** Drops manifest content of every bundle that has a path and heads no channel. */
    void clearNonHeadBundles() throws CatalogException;
}
