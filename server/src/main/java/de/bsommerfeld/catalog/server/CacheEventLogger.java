package de.bsommerfeld.catalog.server;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.catalog.core.event.ApplicationEventBus;
import de.bsommerfeld.catalog.core.event.CacheEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs cache lifecycle events posted on the {@link ApplicationEventBus}.
 */
@Singleton
public class CacheEventLogger {

    private static final Logger LOG = LoggerFactory.getLogger(CacheEventLogger.class);

    @Inject
    public CacheEventLogger(ApplicationEventBus eventBus) {
        eventBus.register(this);
    }

    @Subscribe
    public void onBuildStarted(CacheEvents.BuildStarted event) {
        LOG.info("Building {} cache from {}", event.backend(), event.source());
    }

    @Subscribe
    public void onBuildCompleted(CacheEvents.BuildCompleted event) {
        LOG.info("Cache build finished: {} packages, digest {}, took {} ms", event.packages(), event.digest(),
                event.duration().toMillis());
    }

    @Subscribe
    public void onIntegrityMismatch(CacheEvents.IntegrityMismatch event) {
        LOG.warn("Cache digest mismatch (stored {}, computed {})", event.storedDigest(), event.computedDigest());
    }
}
