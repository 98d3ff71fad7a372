package de.bsommerfeld.catalog.cache;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.bsommerfeld.catalog.cache.backend.BackendSelector;
import de.bsommerfeld.catalog.cache.backend.CacheBackend;
import de.bsommerfeld.catalog.cache.declcfg.CatalogWalker;
import de.bsommerfeld.catalog.cache.declcfg.ConvertedPackage;
import de.bsommerfeld.catalog.cache.declcfg.DeclarativeConfig;
import de.bsommerfeld.catalog.cache.declcfg.ModelConverter;
import de.bsommerfeld.catalog.cache.index.CacheKey;
import de.bsommerfeld.catalog.cache.index.CachedBundle;
import de.bsommerfeld.catalog.cache.index.CachedPackage;
import de.bsommerfeld.catalog.cache.index.PackageIndex;
import de.bsommerfeld.catalog.core.config.CacheConfig;
import de.bsommerfeld.catalog.core.error.CacheException;
import de.bsommerfeld.catalog.core.error.CatalogException;
import de.bsommerfeld.catalog.core.error.IntegrityException;
import de.bsommerfeld.catalog.core.error.NotFoundException;
import de.bsommerfeld.catalog.core.event.ApplicationEventBus;
import de.bsommerfeld.catalog.core.event.CacheEvents;
import de.bsommerfeld.catalog.core.model.Bundle;
import de.bsommerfeld.catalog.core.model.ChannelEntry;
import de.bsommerfeld.catalog.core.model.GroupVersionKind;
import de.bsommerfeld.catalog.core.model.PackageManifest;
import de.bsommerfeld.catalog.core.query.BundleSink;
import de.bsommerfeld.catalog.core.query.CatalogQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Query engine over a cache built from a declarative source catalog.
 *
 * <pre>
 *   source dir ──walk──▶ MetaSpool (one section per package)
 *                              │
 *                 ┌────────────┼────────────┐   fixed worker pool,
 *                 ▼            ▼            ▼   first failure cancels all
 *             package A    package B    package C
 *             parse, validate, putBundle per membership
 *                 └────────────┼────────────┘
 *                              ▼
 *              package index ─▶ backend ◀─ digest
 * </pre>
 *
 * Building and loading take the write lock; queries share the read lock and
 * answer from the in-memory {@link PackageIndex}, fetching full bundles from
 * the backend.
 */
public class CatalogCache implements CatalogQuery, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogCache.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;
    private static final Comparator<ChannelEntry> ENTRY_ORDER = Comparator.comparing(ChannelEntry::packageName)
            .thenComparing(ChannelEntry::channelName)
            .thenComparing(ChannelEntry::bundleName)
            .thenComparing(ChannelEntry::replaces);

    private final CacheBackend backend;
    private final int workers;
    private final ApplicationEventBus eventBus;
    private final CatalogWalker walker = new CatalogWalker();
    private final ModelConverter converter = new ModelConverter();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private PackageIndex index;

    public CatalogCache(CacheBackend backend, int workers, ApplicationEventBus eventBus) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be positive: " + workers);
        }
        this.backend = backend;
        this.workers = workers;
        this.eventBus = eventBus;
    }

    /**
     * Opens the cache stored in {@code dir}, choosing the backend as
     * configured.
     */
    public static CatalogCache open(Path dir, CacheConfig config, ApplicationEventBus eventBus)
            throws CatalogException {
        CacheBackend backend = BackendSelector.select(dir, config.getBackend());
        try {
            backend.open();
        } catch (IOException e) {
            throw new CacheException("Failed to open " + backend.name() + " cache in " + dir, e);
        }
        LOG.info("Opened {} cache in {}", backend.name(), dir);
        return new CatalogCache(backend, config.effectiveWorkers(), eventBus);
    }

    public String backendName() {
        return backend.name();
    }

    /** Digest recorded by the last build, {@code ""} if the cache was never built. */
    public String storedDigest() throws CacheException {
        lock.readLock().lock();
        try {
            return backend.getDigest();
        } catch (IOException e) {
            throw new CacheException("Failed to read cache digest", e);
        } finally {
            lock.readLock().unlock();
        }
    }

    // =====================================================================
    // Lifecycle
    // =====================================================================

    /**
     * Compares the stored digest with one computed over {@code source} and
     * the current cache content.
     *
     * @throws IntegrityException if the digests differ
     */
    public void checkIntegrity(Path source) throws CatalogException {
        lock.readLock().lock();
        try {
            String stored = backend.getDigest();
            String computed = backend.computeDigest(source);
            if (!stored.equals(computed)) {
                eventBus.post(new CacheEvents.IntegrityMismatch(stored, computed));
                throw new IntegrityException(stored, computed);
            }
            LOG.debug("Cache digest {} matches source {}", stored, source);
        } catch (IOException e) {
            throw new CacheException("Failed to check cache integrity", e);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Rebuilds the cache from {@code source}. Packages are converted and
     * stored in parallel; the first failing package cancels the others and
     * its error is rethrown. The in-memory index is not touched, call
     * {@link #load()} afterwards.
     */
    public void build(Path source) throws CatalogException {
        lock.writeLock().lock();
        Stopwatch stopwatch = Stopwatch.createStarted();
        eventBus.post(new CacheEvents.BuildStarted(backend.name(), source.toString()));
        try {
            backend.init();
            Map<String, CachedPackage> packages;
            try (MetaSpool spool = MetaSpool.create()) {
                walker.walk(source, (file, meta) -> {
                    if (meta.packageName().isEmpty()) {
                        LOG.warn("Skipping {} object without package in {}", meta.schema(), file);
                        return;
                    }
                    spool.append(meta);
                });
                packages = buildPackages(spool);
            }
            backend.putPackageIndex(packages);
            String digest = backend.computeDigest(source);
            backend.putDigest(digest);

            eventBus.post(new CacheEvents.BuildCompleted(backend.name(), packages.size(), digest,
                    stopwatch.elapsed()));
            LOG.info("Built {} cache with {} packages in {} ms", backend.name(), packages.size(),
                    stopwatch.elapsed(TimeUnit.MILLISECONDS));
        } catch (IOException e) {
            throw new CacheException("Failed to build cache from " + source, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Map<String, CachedPackage> buildPackages(MetaSpool spool) throws CatalogException {
        Map<String, CachedPackage> packages = new TreeMap<>();
        Lock packagesLock = new ReentrantLock();

        ExecutorService pool = Executors.newFixedThreadPool(workers, new ThreadFactoryBuilder()
                .setNameFormat("cache-build-%d")
                .setDaemon(true)
                .build());
        CompletionService<String> completion = new ExecutorCompletionService<>(pool);
        Map<Future<String>, String> pending = new HashMap<>();
        try {
            for (String packageName : spool.packages()) {
                pending.put(completion.submit(() -> {
                    for (CachedPackage summary : buildPackage(packageName, spool)) {
                        packagesLock.lock();
                        try {
                            packages.put(summary.name(), summary);
                        } finally {
                            packagesLock.unlock();
                        }
                    }
                    return packageName;
                }), packageName);
            }
            for (int i = 0; i < pending.size(); i++) {
                Future<String> done = completion.take();
                try {
                    LOG.debug("Cached package {}", done.get());
                } catch (ExecutionException e) {
                    cancelAll(pending.keySet());
                    throw failure(pending.get(done), e.getCause());
                }
            }
        } catch (InterruptedException e) {
            cancelAll(pending.keySet());
            Thread.currentThread().interrupt();
            throw new CacheException("cache build interrupted", e);
        } finally {
            MoreExecutors.shutdownAndAwaitTermination(pool, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        }

        packagesLock.lock();
        try {
            return new TreeMap<>(packages);
        } finally {
            packagesLock.unlock();
        }
    }

    private List<CachedPackage> buildPackage(String packageName, MetaSpool spool)
            throws IOException, CatalogException {
        DeclarativeConfig config = DeclarativeConfig.parse(spool.read(packageName));
        List<CachedPackage> summaries = new ArrayList<>();
        for (ConvertedPackage converted : converter.convert(config)) {
            for (Bundle bundle : converted.bundles()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CacheException("build of package " + packageName + " cancelled");
                }
                backend.putBundle(new CacheKey(bundle.packageName(), bundle.channelName(), bundle.name()), bundle);
            }
            summaries.add(converted.summary());
        }
        return summaries;
    }

    private static void cancelAll(Set<Future<String>> futures) {
        for (Future<String> future : futures) {
            future.cancel(true);
        }
    }

    private static CatalogException failure(String packageName, Throwable cause) {
        LOG.warn("Failed to cache package {}: {}", packageName, cause.getMessage());
        if (cause instanceof CatalogException) {
            return (CatalogException) cause;
        }
        return new CacheException("process package " + packageName + ": " + cause.getMessage(), cause);
    }

    /** Reads the persisted package index into memory. */
    public void load() throws CatalogException {
        lock.writeLock().lock();
        try {
            index = new PackageIndex(backend.getPackageIndex());
            LOG.info("Loaded {} cache index with {} packages", backend.name(), index.size());
        } catch (IOException e) {
            throw new CacheException("Failed to load cache index", e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Checks integrity against {@code source}, rebuilds on any failure, then loads. */
    public void loadOrRebuild(Path source) throws CatalogException {
        try {
            checkIntegrity(source);
        } catch (CatalogException e) {
            LOG.warn("{}; rebuilding", e.getMessage());
            try {
                build(source);
            } catch (CatalogException buildError) {
                throw new CacheException("failed to rebuild cache: " + buildError.getMessage(), buildError);
            }
        }
        load();
    }

    @Override
    public void close() throws CacheException {
        lock.writeLock().lock();
        try {
            backend.close();
        } catch (IOException e) {
            throw new CacheException("Failed to close " + backend.name() + " cache", e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // =====================================================================
    // Queries
    // =====================================================================

    @Override
    public List<String> listPackages() throws CatalogException {
        lock.readLock().lock();
        try {
            return requireIndex().packageNames();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public PackageManifest getPackage(String name) throws CatalogException {
        lock.readLock().lock();
        try {
            return requireIndex().manifest(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Bundle getBundle(String pkg, String channel, String csvName) throws CatalogException {
        lock.readLock().lock();
        try {
            return fetch(requireIndex().bundleKey(pkg, channel, csvName));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Bundle getBundleForChannel(String pkg, String channel) throws CatalogException {
        lock.readLock().lock();
        try {
            return fetch(requireIndex().headKey(pkg, channel));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ChannelEntry> getChannelEntriesThatReplace(String name) throws CatalogException {
        lock.readLock().lock();
        try {
            return requireIndex().entriesThatReplace(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Bundle getBundleThatReplaces(String name, String pkg, String channel) throws CatalogException {
        lock.readLock().lock();
        try {
            return fetch(requireIndex().replacerKey(name, pkg, channel));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ChannelEntry> getChannelEntriesThatProvide(GroupVersionKind gvk) throws CatalogException {
        lock.readLock().lock();
        try {
            List<ChannelEntry> entries = providers(requireIndex().bundles(), gvk);
            if (entries.isEmpty()) {
                throw new NotFoundException("no channel entries found that provide " + gvk);
            }
            return entries;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ChannelEntry> getLatestChannelEntriesThatProvide(GroupVersionKind gvk) throws CatalogException {
        lock.readLock().lock();
        try {
            List<ChannelEntry> entries = new ArrayList<>();
            for (CachedBundle head : requireIndex().heads()) {
                if (fetch(keyOf(head)).provides(gvk)) {
                    entries.add(new ChannelEntry(head.packageName(), head.channelName(), head.name(),
                            head.replaces()));
                }
            }
            if (entries.isEmpty()) {
                throw new NotFoundException("no channel entries found that provide " + gvk);
            }
            return entries;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Bundle getBundleThatProvides(GroupVersionKind gvk) throws CatalogException {
        lock.readLock().lock();
        try {
            PackageIndex current = requireIndex();
            for (CachedBundle head : current.heads()) {
                String defaultChannel = current.requirePackage(head.packageName()).defaultChannel();
                if (head.channelName().equals(defaultChannel)) {
                    Bundle bundle = fetch(keyOf(head));
                    if (bundle.provides(gvk)) {
                        return bundle;
                    }
                }
            }
            throw new NotFoundException("no bundle found that provides " + gvk);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Streams every stored bundle in backend order, manifest content dropped. */
    @Override
    public void sendBundles(BundleSink sink) throws CatalogException, IOException {
        lock.readLock().lock();
        try {
            requireIndex();
            backend.sendBundles(bundle -> sink.send(bundle.withoutContent()));
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<ChannelEntry> providers(List<CachedBundle> members, GroupVersionKind gvk) throws CatalogException {
        Set<ChannelEntry> entries = new LinkedHashSet<>();
        for (CachedBundle member : members) {
            if (fetch(keyOf(member)).provides(gvk)) {
                entries.addAll(PackageIndex.entriesOf(member));
            }
        }
        List<ChannelEntry> sorted = new ArrayList<>(entries);
        sorted.sort(ENTRY_ORDER);
        return sorted;
    }

    private Bundle fetch(CacheKey key) throws CatalogException {
        try {
            Bundle bundle = backend.getBundle(key);
            if (bundle == null) {
                throw new NotFoundException(String.format("bundle %s not found in %s/%s",
                        key.name(), key.packageName(), key.channelName()));
            }
            return bundle;
        } catch (IOException e) {
            throw new CacheException("Failed to read bundle " + key, e);
        }
    }

    private static CacheKey keyOf(CachedBundle bundle) {
        return new CacheKey(bundle.packageName(), bundle.channelName(), bundle.name());
    }

    private PackageIndex requireIndex() throws CacheException {
        if (index == null) {
            throw new CacheException("cache index is not loaded");
        }
        return index;
    }
}
