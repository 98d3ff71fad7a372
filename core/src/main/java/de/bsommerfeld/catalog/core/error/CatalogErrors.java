package de.bsommerfeld.catalog.core.error;

import java.util.List;

/**
 * Helpers for operations that collect errors before reporting them.
 */
public final class CatalogErrors {

    private CatalogErrors() {
    }

    /**
     * Throws nothing for an empty list, the error itself for a single one and
     * an {@link AggregateException} otherwise.
     */
    public static void throwIfAny(List<? extends CatalogException> errors) throws CatalogException {
        if (errors.isEmpty()) {
            return;
        }
        if (errors.size() == 1) {
            throw errors.get(0);
        }
        throw new AggregateException(errors);
    }
}
