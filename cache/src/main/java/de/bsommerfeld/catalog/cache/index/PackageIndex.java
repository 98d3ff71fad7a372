package de.bsommerfeld.catalog.cache.index;

import de.bsommerfeld.catalog.core.error.NotFoundException;
import de.bsommerfeld.catalog.core.model.ChannelEntry;
import de.bsommerfeld.catalog.core.model.PackageChannel;
import de.bsommerfeld.catalog.core.model.PackageManifest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * In-memory package index of a loaded cache. Answers every structural
 * question (channels, heads, replacement edges) without touching the
 * backend; callers fetch full bundles by the returned {@link CacheKey}s.
 *
 * <p>
 * Iteration is always by package, then channel, then bundle name.
 */
public class PackageIndex {

    private final Map<String, CachedPackage> packages;

    public PackageIndex(Map<String, CachedPackage> packages) {
        this.packages = Collections.unmodifiableSortedMap(new TreeMap<>(packages));
    }

    public int size() {
        return packages.size();
    }

    public List<String> packageNames() {
        return new ArrayList<>(packages.keySet());
    }

    public CachedPackage requirePackage(String name) throws NotFoundException {
        CachedPackage pkg = packages.get(name);
        if (pkg == null) {
            throw new NotFoundException("package " + name + " not found");
        }
        return pkg;
    }

    public PackageManifest manifest(String name) throws NotFoundException {
        CachedPackage pkg = requirePackage(name);
        List<PackageChannel> channels = new ArrayList<>();
        for (CachedChannel channel : pkg.channels().values()) {
            channels.add(new PackageChannel(channel.name(), channel.head()));
        }
        return new PackageManifest(pkg.name(), channels, pkg.defaultChannel());
    }

    public CachedChannel requireChannel(String pkg, String channel) throws NotFoundException {
        CachedPackage cached = packages.get(pkg);
        CachedChannel found = cached == null ? null : cached.channels().get(channel);
        if (found == null) {
            throw new NotFoundException("channel " + channel + " not found in package " + pkg);
        }
        return found;
    }

    public CacheKey bundleKey(String pkg, String channel, String name) throws NotFoundException {
        CachedPackage cached = packages.get(pkg);
        CachedChannel ch = cached == null ? null : cached.channels().get(channel);
        if (ch == null || !ch.bundles().containsKey(name)) {
            throw new NotFoundException(String.format("bundle %s not found in %s/%s", name, pkg, channel));
        }
        return new CacheKey(pkg, channel, name);
    }

    public CacheKey headKey(String pkg, String channel) throws NotFoundException {
        return new CacheKey(pkg, channel, requireChannel(pkg, channel).head());
    }

    /** The lexically smallest member of the channel that replaces or skips {@code name}. */
    public CacheKey replacerKey(String name, String pkg, String channel) throws NotFoundException {
        CachedPackage cached = packages.get(pkg);
        CachedChannel ch = cached == null ? null : cached.channels().get(channel);
        if (ch != null) {
            for (CachedBundle bundle : ch.bundles().values()) {
                if (bundle.supersedes(name)) {
                    return new CacheKey(pkg, channel, bundle.name());
                }
            }
        }
        throw new NotFoundException(String.format("no entry found for %s %s that replaces %s", pkg, channel, name));
    }

    public List<ChannelEntry> entriesThatReplace(String name) throws NotFoundException {
        List<ChannelEntry> entries = new ArrayList<>();
        for (CachedBundle bundle : bundles()) {
            if (bundle.supersedes(name)) {
                entries.add(new ChannelEntry(bundle.packageName(), bundle.channelName(), bundle.name(), name));
            }
        }
        if (entries.isEmpty()) {
            throw new NotFoundException("no channel entries found that replace " + name);
        }
        return entries;
    }

    /**
     * The entries a bundle contributes to its channel: its own replacement
     * edge plus one edge per skipped bundle not already covered.
     */
    public static List<ChannelEntry> entriesOf(CachedBundle bundle) {
        List<ChannelEntry> entries = new ArrayList<>();
        entries.add(new ChannelEntry(bundle.packageName(), bundle.channelName(), bundle.name(), bundle.replaces()));
        for (String skip : new TreeSet<>(bundle.skips())) {
            if (!skip.equals(bundle.replaces())) {
                entries.add(new ChannelEntry(bundle.packageName(), bundle.channelName(), bundle.name(), skip));
            }
        }
        return entries;
    }

    /** Every channel membership. */
    public List<CachedBundle> bundles() {
        List<CachedBundle> bundles = new ArrayList<>();
        for (CachedPackage pkg : packages.values()) {
            for (CachedChannel channel : pkg.channels().values()) {
                bundles.addAll(channel.bundles().values());
            }
        }
        return bundles;
    }

    /** The head membership of every channel. */
    public List<CachedBundle> heads() {
        List<CachedBundle> heads = new ArrayList<>();
        for (CachedPackage pkg : packages.values()) {
            for (CachedChannel channel : pkg.channels().values()) {
                CachedBundle head = channel.bundles().get(channel.head());
                if (head != null) {
                    heads.add(head);
                }
            }
        }
        return heads;
    }
}
