package de.bsommerfeld.catalog.core.query;

import de.bsommerfeld.catalog.core.error.CatalogException;
import de.bsommerfeld.catalog.core.error.NotFoundException;
import de.bsommerfeld.catalog.core.model.Bundle;
import de.bsommerfeld.catalog.core.model.ChannelEntry;
import de.bsommerfeld.catalog.core.model.GroupVersionKind;
import de.bsommerfeld.catalog.core.model.PackageManifest;

import java.io.IOException;
import java.util.List;

/**
 * Read-only query surface over a catalog. Implemented by the relational store
 * and by the cache; both answer with the same graph semantics, including
 * synthetic skip entries as valid "replaces" answers.
 *
 * <p>
 * Every lookup that finds nothing throws {@link NotFoundException} rather than
 * returning {@code null} or an empty list. Implementations are safe for
 * concurrent callers.
 */
public interface CatalogQuery {

    /** Names of all packages in lexical order. */
    List<String> listPackages() throws CatalogException;

    /** Channels (sorted by name, with their heads) and default channel of a package. */
    PackageManifest getPackage(String name) throws CatalogException;

    /** The bundle {@code csvName} as a member of {@code pkg}/{@code channel}. */
    Bundle getBundle(String pkg, String channel, String csvName) throws CatalogException;

    /** The head of {@code pkg}/{@code channel}. */
    Bundle getBundleForChannel(String pkg, String channel) throws CatalogException;

    /** Every entry, across all packages, that replaces or skips {@code name}. */
    List<ChannelEntry> getChannelEntriesThatReplace(String name) throws CatalogException;

    /**
     * The bundle in {@code pkg}/{@code channel} that replaces or skips
     * {@code name}. The lexically smallest one wins when several qualify.
     */
    Bundle getBundleThatReplaces(String name, String pkg, String channel) throws CatalogException;

    /** Every entry, across all packages, of a bundle providing {@code gvk}. */
    List<ChannelEntry> getChannelEntriesThatProvide(GroupVersionKind gvk) throws CatalogException;

    /**
     * One entry per channel whose head provides {@code gvk}. Channels whose
     * head does not provide it are not searched further.
     */
    List<ChannelEntry> getLatestChannelEntriesThatProvide(GroupVersionKind gvk) throws CatalogException;

    /**
     * The default-channel head providing {@code gvk}; ties between packages are
     * broken by lexical package name.
     */
    Bundle getBundleThatProvides(GroupVersionKind gvk) throws CatalogException;

    /**
     * Streams every bundle once per channel membership. Bundles with a path
     * are sent without their manifest content.
     */
    void sendBundles(BundleSink sink) throws CatalogException, IOException;
}
