package de.bsommerfeld.catalog.core.event;

import com.google.common.eventbus.DeadEvent;
import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.Subscribe;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guava EventBus carrying {@link CacheEvents} from the cache engine to
 * whoever listens (the server logs them). A failing listener is logged and
 * never reaches the poster, so a cache build cannot fail because of one.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::onListenerFailure);
        this.eventBus.register(new DeadEventLogger());
    }

    public void post(Object event) {
        LOG.debug("Posting {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    private static void onListenerFailure(Throwable error, SubscriberExceptionContext context) {
        LOG.error("Listener {}.{} failed on {}", context.getSubscriber().getClass().getSimpleName(),
                context.getSubscriberMethod().getName(), context.getEvent(), error);
    }

    private static final class DeadEventLogger {

        @Subscribe
        public void onDeadEvent(DeadEvent dead) {
            LOG.trace("No listener for {}", dead.getEvent());
        }
    }
}
