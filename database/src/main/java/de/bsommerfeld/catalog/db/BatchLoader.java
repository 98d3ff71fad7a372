package de.bsommerfeld.catalog.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.catalog.core.config.BatchMode;
import de.bsommerfeld.catalog.core.config.DatabaseConfig;
import de.bsommerfeld.catalog.core.error.CatalogErrors;
import de.bsommerfeld.catalog.core.error.CatalogException;
import de.bsommerfeld.catalog.core.model.Bundle;
import de.bsommerfeld.catalog.core.model.PackageManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Adds many bundles or package manifests. Each item is its own transaction,
 * so a failed item never leaves partial rows behind.
 *
 * <p>
 * In {@link BatchMode#PERMISSIVE} failures are logged, the batch continues
 * and all failures are thrown together at the end. In
 * {@link BatchMode#STRICT} the first failure stops the batch; items added
 * before it stay committed.
 */
@Singleton
public class BatchLoader {

    private static final Logger LOG = LoggerFactory.getLogger(BatchLoader.class);

    private final CatalogLoader loader;
    private final BatchMode mode;

    @Inject
    public BatchLoader(CatalogLoader loader, DatabaseConfig config) {
        this(loader, config.getBatchMode());
    }

    public BatchLoader(CatalogLoader loader, BatchMode mode) {
        this.loader = loader;
        this.mode = mode;
    }

    public void addBundles(List<Bundle> bundles) throws CatalogException {
        List<CatalogException> errors = new ArrayList<>();
        for (Bundle bundle : bundles) {
            try {
                loader.addBundle(bundle);
            } catch (CatalogException e) {
                record(errors, "bundle " + bundle.name(), e);
            }
        }
        CatalogErrors.throwIfAny(errors);
    }

    public void addPackages(List<PackageManifest> manifests) throws CatalogException {
        List<CatalogException> errors = new ArrayList<>();
        for (PackageManifest manifest : manifests) {
            try {
                loader.addPackageChannels(manifest);
            } catch (CatalogException e) {
                record(errors, "package " + manifest.packageName(), e);
            }
        }
        CatalogErrors.throwIfAny(errors);
    }

    private void record(List<CatalogException> errors, String item, CatalogException e) throws CatalogException {
        if (mode == BatchMode.STRICT) {
            throw e;
        }
        LOG.warn("Failed to add {}: {}", item, e.getMessage());
        errors.add(e);
    }
}
