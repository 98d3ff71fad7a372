package de.bsommerfeld.catalog.core.config;

import com.google.common.base.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Running mode of the catalog. TEST keeps every store volatile: the
 * relational catalog lives in a temporary file deleted on exit and the
 * cache in a temporary directory.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    public static final String PROPERTY = "app.mode";
    public static final String ENVIRONMENT = "APP_MODE";

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /** Resolves the mode from {@value #PROPERTY}, then {@value #ENVIRONMENT}. */
    public static ApplicationMode get() {
        String mode = System.getProperty(PROPERTY);
        if (Strings.isNullOrEmpty(mode)) {
            mode = System.getenv(ENVIRONMENT);
        }
        return parse(mode);
    }

    /** Case-insensitive; blank or unknown names fall back to PROD. */
    public static ApplicationMode parse(String name) {
        if (Strings.isNullOrEmpty(name) || name.isBlank()) {
            return PROD;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}', serving the catalog in PROD mode", name);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
