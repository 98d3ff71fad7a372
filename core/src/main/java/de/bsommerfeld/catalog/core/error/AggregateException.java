package de.bsommerfeld.catalog.core.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Several independent failures reported together. Each one is also
 * attached as a suppressed exception so stack traces survive logging.
 */
public class AggregateException extends CatalogException {

    private final List<CatalogException> errors;

    public AggregateException(List<? extends CatalogException> errors) {
        super(errors.stream().map(Throwable::getMessage).collect(Collectors.joining(", ", "[", "]")));
        this.errors = List.copyOf(errors);
        for (CatalogException e : this.errors) {
            addSuppressed(e);
        }
    }

    public List<CatalogException> getErrors() {
        return errors;
    }
}
