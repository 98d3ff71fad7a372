package de.bsommerfeld.catalog.core.event;

import com.google.common.eventbus.Subscribe;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationEventBusTest {

    @Test
    void post_shouldDeliverCacheEventToRegisteredListener() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<CacheEvents.BuildCompleted>();

        Object listener = new Object() {
            @Subscribe
            public void onBuild(CacheEvents.BuildCompleted event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post(new CacheEvents.BuildCompleted("plain", 3, "abc", Duration.ofMillis(5)));

        assertNotNull(received.get());
        assertEquals(3, received.get().packages());
    }

    @Test
    void unregister_shouldStopDeliveringEvents() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<String>();

        Object listener = new Object() {
            @Subscribe
            public void onEvent(String event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post("first");
        eventBus.unregister(listener);
        eventBus.post("second");

        assertEquals("first", received.get());
    }

    @Test
    void post_shouldNotThrowForUnhandledEvents() {
        var eventBus = new ApplicationEventBus();
        assertDoesNotThrow(() -> eventBus.post(new CacheEvents.IntegrityMismatch("a", "b")));
    }

    @Test
    void post_shouldKeepDeliveringWhenOneListenerFails() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<CacheEvents.BuildStarted>();

        eventBus.register(new Object() {
            @Subscribe
            public void explode(CacheEvents.BuildStarted event) {
                throw new IllegalStateException("boom");
            }
        });
        eventBus.register(new Object() {
            @Subscribe
            public void record(CacheEvents.BuildStarted event) {
                received.set(event);
            }
        });

        assertDoesNotThrow(() -> eventBus.post(new CacheEvents.BuildStarted("compact.v1", "/catalog")));
        assertEquals("compact.v1", received.get().backend());
    }
}
