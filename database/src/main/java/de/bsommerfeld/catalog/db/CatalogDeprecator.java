package de.bsommerfeld.catalog.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.catalog.core.config.BatchMode;
import de.bsommerfeld.catalog.core.config.DatabaseConfig;
import de.bsommerfeld.catalog.core.error.BundleImageNotFoundException;
import de.bsommerfeld.catalog.core.error.CatalogErrors;
import de.bsommerfeld.catalog.core.error.CatalogException;
import de.bsommerfeld.catalog.core.error.DeprecationPolicyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Deprecates a batch of bundle paths.
 *
 * <p>
 * A package whose default channel head is requested is removed as a whole,
 * but only when every other channel head of that package is requested too.
 * The remaining paths are deprecated one by one.
 */
@Singleton
public class CatalogDeprecator {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogDeprecator.class);

    private final CatalogLoader loader;
    private final SqlCatalogQuerier querier;
    private final BatchMode mode;

    @Inject
    public CatalogDeprecator(CatalogLoader loader, SqlCatalogQuerier querier, DatabaseConfig config) {
        this(loader, querier, config.getBatchMode());
    }

    public CatalogDeprecator(CatalogLoader loader, SqlCatalogQuerier querier, BatchMode mode) {
        this.loader = loader;
        this.querier = querier;
        this.mode = mode;
    }

    public void deprecate(List<String> bundlePaths) throws CatalogException {
        Set<String> remaining = new LinkedHashSet<>(bundlePaths);
        List<CatalogException> errors = new ArrayList<>();

        Map<String, List<ChannelHead>> headsByPackage = new TreeMap<>();
        for (ChannelHead head : querier.listChannelHeads()) {
            headsByPackage.computeIfAbsent(head.packageName(), p -> new ArrayList<>()).add(head);
        }

        for (Map.Entry<String, List<ChannelHead>> pkg : headsByPackage.entrySet()) {
            ChannelHead defaultHead = pkg.getValue().stream()
                    .filter(ChannelHead::defaultChannel)
                    .findFirst()
                    .orElse(null);
            if (defaultHead == null || !remaining.contains(defaultHead.bundlePath())) {
                continue;
            }
            try {
                removeWholePackage(pkg.getKey(), pkg.getValue(), remaining);
            } catch (CatalogException e) {
                remaining.remove(defaultHead.bundlePath());
                record(errors, e);
            }
        }

        for (String path : remaining) {
            try {
                loader.deprecateBundle(path);
            } catch (BundleImageNotFoundException e) {
                LOG.debug("Skipping {}: already removed", path);
            } catch (CatalogException e) {
                record(errors, e);
            }
        }

        CatalogErrors.throwIfAny(errors);
    }

    private void removeWholePackage(String pkg, List<ChannelHead> heads, Set<String> remaining)
            throws CatalogException {
        for (ChannelHead head : heads) {
            if (!remaining.contains(head.bundlePath())) {
                throw new DeprecationPolicyException(String.format("cannot deprecate default channel head from "
                        + "package without removing all other channel heads in package %s: must deprecate %s, "
                        + "head of channel %s", pkg, head.bundleName(), head.channelName()));
            }
        }
        List<String> paths = querier.getBundlePathsForPackage(pkg);
        loader.removePackage(pkg);
        remaining.removeAll(paths);
        LOG.info("Removed package {}: all channel heads deprecated", pkg);
    }

    private void record(List<CatalogException> errors, CatalogException e) throws CatalogException {
        if (mode == BatchMode.STRICT) {
            throw e;
        }
        LOG.warn("Deprecation failed: {}", e.getMessage());
        errors.add(e);
    }
}
