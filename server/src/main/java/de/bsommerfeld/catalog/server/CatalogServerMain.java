package de.bsommerfeld.catalog.server;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.catalog.server.http.RegistryServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Entry point: {@code CatalogServerMain [config.toml]}.
 */
public final class CatalogServerMain {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogServerMain.class);
    private static final String DEFAULT_CONFIG = "config.toml";

    private CatalogServerMain() {
    }

    public static void main(String[] args) throws Exception {
        Path configPath = Path.of(args.length > 0 ? args[0] : DEFAULT_CONFIG);
        Injector injector = Guice.createInjector(new AppModule(configPath));
        RegistryServer server = injector.getInstance(RegistryServer.class);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.stop();
            } catch (Exception e) {
                LOG.error("Failed to stop catalog server", e);
            }
        }, "catalog-shutdown"));

        server.start();
        server.join();
    }
}
