package de.bsommerfeld.catalog.server;

import com.google.inject.AbstractModule;
import com.google.inject.Provider;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.catalog.cache.CatalogCache;
import de.bsommerfeld.catalog.core.config.ApplicationMode;
import de.bsommerfeld.catalog.core.config.CacheConfig;
import de.bsommerfeld.catalog.core.config.CatalogConfig;
import de.bsommerfeld.catalog.core.config.ConfigLoader;
import de.bsommerfeld.catalog.core.config.DatabaseConfig;
import de.bsommerfeld.catalog.core.config.ServerConfig;
import de.bsommerfeld.catalog.core.error.CatalogException;
import de.bsommerfeld.catalog.core.event.ApplicationEventBus;
import de.bsommerfeld.catalog.core.query.CatalogQuery;
import de.bsommerfeld.catalog.db.CatalogLoader;
import de.bsommerfeld.catalog.db.GraphLoader;
import de.bsommerfeld.catalog.db.SqlCatalogLoader;
import de.bsommerfeld.catalog.db.SqlCatalogQuerier;
import de.bsommerfeld.catalog.db.SqlGraphLoader;
import de.bsommerfeld.catalog.db.SqliteDatabase;
import de.bsommerfeld.catalog.db.migration.Migrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Guice wiring of the catalog server. Loads config.toml and answers queries
 * from the cache or the relational store depending on
 * {@code server.source}.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final Path configPath;
    private final ApplicationMode mode;

    public AppModule(Path configPath) {
        this(configPath, ApplicationMode.get());
    }

    public AppModule(Path configPath, ApplicationMode mode) {
        this.configPath = configPath;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        CatalogConfig config;
        try {
            config = ConfigLoader.load(configPath);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration from " + configPath, e);
        }

        bind(CatalogConfig.class).toInstance(config);
        bind(DatabaseConfig.class).toInstance(config.getDatabase());
        bind(CacheConfig.class).toInstance(config.getCache());
        bind(ServerConfig.class).toInstance(config.getServer());

        LOG.info("Application Mode initialized: {}", mode);
        bind(ApplicationMode.class).toInstance(mode);

        bind(CatalogLoader.class).to(SqlCatalogLoader.class);
        bind(GraphLoader.class).to(SqlGraphLoader.class);
        bind(CacheEventLogger.class).asEagerSingleton();
    }

    @Provides
    @Singleton
    SqliteDatabase database(DatabaseConfig config) throws IOException, CatalogException {
        SqliteDatabase db = mode.isTest()
                ? SqliteDatabase.temporary()
                : new SqliteDatabase(Path.of(config.getPath()));
        new Migrator(db).migrate();
        return db;
    }

    @Provides
    @Singleton
    CatalogCache cache(CacheConfig config, ApplicationEventBus eventBus) throws IOException, CatalogException {
        Path dir = mode.isTest()
                ? Files.createTempDirectory("catalog-cache-")
                : Path.of(config.getDir());
        CatalogCache cache = CatalogCache.open(dir, config, eventBus);
        cache.loadOrRebuild(Path.of(config.getSource()));
        return cache;
    }

    @Provides
    @Singleton
    CatalogQuery query(ServerConfig config, Provider<CatalogCache> cache, Provider<SqlCatalogQuerier> database) {
        LOG.info("Serving queries from {}", config.getSource());
        if (config.getSource() == ServerConfig.Source.DATABASE) {
            return database.get();
        }
        return cache.get();
    }
}
