package de.bsommerfeld.catalog.core.query;

import de.bsommerfeld.catalog.core.model.Bundle;

import java.io.IOException;

/**
 * Receives bundles streamed by {@link CatalogQuery#sendBundles}.
 */
@FunctionalInterface
public interface BundleSink {

    void send(Bundle bundle) throws IOException;
}
