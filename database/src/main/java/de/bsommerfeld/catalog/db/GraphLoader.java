package de.bsommerfeld.catalog.db;

import de.bsommerfeld.catalog.core.error.CatalogException;
import de.bsommerfeld.catalog.core.error.GraphStructureException;
import de.bsommerfeld.catalog.core.graph.PackageGraph;

import java.util.function.Consumer;

/**
 * Reconstructs the replacement graph of a stored package. Read-only.
 */
public interface GraphLoader {

    /**
     * Builds the graph of every channel of {@code packageName}.
     *
     * @throws CatalogException a {@link GraphStructureException}, or an
     *                          aggregate of several, when any channel is
     *                          malformed
     */
    PackageGraph generate(String packageName) throws CatalogException;

    /**
     * Builds the graph of every well-formed channel and reports malformed
     * ones to {@code onChannelError} instead of failing.
     */
    PackageGraph generate(String packageName, Consumer<GraphStructureException> onChannelError)
            throws CatalogException;
}
