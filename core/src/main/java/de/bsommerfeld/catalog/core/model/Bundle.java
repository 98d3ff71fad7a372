package de.bsommerfeld.catalog.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable release unit of an operator package. The same record serves as
 * loader input (channel unset) and as query result (channel set to the
 * channel the bundle was resolved in).
 *
 * <p>
 * Absent strings are normalized to {@code ""} and absent lists to empty
 * lists, so callers never see {@code null} for any component.
 *
 * @param name           unique CSV-style identifier (e.g. {@code acme.v2})
 * @param packageName    owning package
 * @param channelName    channel this value was resolved in, {@code ""} for
 *                       loader input
 * @param version        semantic version string
 * @param bundlePath     content locator (image reference)
 * @param replaces       direct predecessor, {@code ""} if none
 * @param skips          additional predecessors superseded by this release
 * @param skipRange      version range additionally superseded
 * @param substitutesFor bundle this one is a drop-in replacement for (alpha)
 * @param providedApis   APIs this bundle provides
 * @param requiredApis   APIs this bundle requires
 * @param properties     typed facts, values are JSON documents
 * @param dependencies   typed requirements, values are JSON documents
 * @param relatedImages  images referenced by the bundle
 * @param csvJson        full ClusterServiceVersion manifest, {@code ""} when
 *                       trimmed
 * @param objects        full manifest objects, empty when trimmed
 */
public record Bundle(
        String name,
        String packageName,
        String channelName,
        String version,
        String bundlePath,
        String replaces,
        List<String> skips,
        String skipRange,
        String substitutesFor,
        List<GroupVersionKind> providedApis,
        List<GroupVersionKind> requiredApis,
        List<Property> properties,
        List<Dependency> dependencies,
        List<String> relatedImages,
        String csvJson,
        List<String> objects) {

    public Bundle {
        name = orEmpty(name);
        packageName = orEmpty(packageName);
        channelName = orEmpty(channelName);
        version = orEmpty(version);
        bundlePath = orEmpty(bundlePath);
        replaces = orEmpty(replaces);
        skips = skips == null ? List.of() : List.copyOf(skips);
        skipRange = orEmpty(skipRange);
        substitutesFor = orEmpty(substitutesFor);
        providedApis = providedApis == null ? List.of() : List.copyOf(providedApis);
        requiredApis = requiredApis == null ? List.of() : List.copyOf(requiredApis);
        properties = properties == null ? List.of() : List.copyOf(properties);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        relatedImages = relatedImages == null ? List.of() : List.copyOf(relatedImages);
        csvJson = orEmpty(csvJson);
        objects = objects == null ? List.of() : List.copyOf(objects);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Builder toBuilder() {
        Builder b = new Builder(name);
        b.packageName = packageName;
        b.channelName = channelName;
        b.version = version;
        b.bundlePath = bundlePath;
        b.replaces = replaces;
        b.skips = new ArrayList<>(skips);
        b.skipRange = skipRange;
        b.substitutesFor = substitutesFor;
        b.providedApis = new ArrayList<>(providedApis);
        b.requiredApis = new ArrayList<>(requiredApis);
        b.properties = new ArrayList<>(properties);
        b.dependencies = new ArrayList<>(dependencies);
        b.relatedImages = new ArrayList<>(relatedImages);
        b.csvJson = csvJson;
        b.objects = new ArrayList<>(objects);
        return b;
    }

    /** Returns a copy resolved in the given channel. */
    public Bundle inChannel(String channel) {
        return toBuilder().channelName(channel).build();
    }

    /**
     * Drops the heavy manifest content. Only applies when the bundle has a
     * path the content can be fetched from again.
     */
    public Bundle withoutContent() {
        if (bundlePath.isEmpty()) {
            return this;
        }
        return toBuilder().csvJson("").objects(List.of()).build();
    }

    public boolean provides(GroupVersionKind gvk) {
        for (GroupVersionKind api : providedApis) {
            if (api.sameType(gvk)) {
                return true;
            }
        }
        return false;
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }

    public static final class Builder {

        private final String name;
        private String packageName;
        private String channelName;
        private String version;
        private String bundlePath;
        private String replaces;
        private List<String> skips = new ArrayList<>();
        private String skipRange;
        private String substitutesFor;
        private List<GroupVersionKind> providedApis = new ArrayList<>();
        private List<GroupVersionKind> requiredApis = new ArrayList<>();
        private List<Property> properties = new ArrayList<>();
        private List<Dependency> dependencies = new ArrayList<>();
        private List<String> relatedImages = new ArrayList<>();
        private String csvJson;
        private List<String> objects = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder packageName(String packageName) {
            this.packageName = packageName;
            return this;
        }

        public Builder channelName(String channelName) {
            this.channelName = channelName;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder bundlePath(String bundlePath) {
            this.bundlePath = bundlePath;
            return this;
        }

        public Builder replaces(String replaces) {
            this.replaces = replaces;
            return this;
        }

        public Builder skips(List<String> skips) {
            this.skips = new ArrayList<>(skips);
            return this;
        }

        public Builder skips(String... skips) {
            return skips(List.of(skips));
        }

        public Builder skipRange(String skipRange) {
            this.skipRange = skipRange;
            return this;
        }

        public Builder substitutesFor(String substitutesFor) {
            this.substitutesFor = substitutesFor;
            return this;
        }

        public Builder providedApis(List<GroupVersionKind> providedApis) {
            this.providedApis = new ArrayList<>(providedApis);
            return this;
        }

        public Builder provides(GroupVersionKind gvk) {
            this.providedApis.add(gvk);
            return this;
        }

        public Builder requiredApis(List<GroupVersionKind> requiredApis) {
            this.requiredApis = new ArrayList<>(requiredApis);
            return this;
        }

        public Builder requires(GroupVersionKind gvk) {
            this.requiredApis.add(gvk);
            return this;
        }

        public Builder properties(List<Property> properties) {
            this.properties = new ArrayList<>(properties);
            return this;
        }

        public Builder property(Property property) {
            this.properties.add(property);
            return this;
        }

        public Builder dependencies(List<Dependency> dependencies) {
            this.dependencies = new ArrayList<>(dependencies);
            return this;
        }

        public Builder dependency(Dependency dependency) {
            this.dependencies.add(dependency);
            return this;
        }

        public Builder relatedImages(List<String> relatedImages) {
            this.relatedImages = new ArrayList<>(relatedImages);
            return this;
        }

        public Builder csvJson(String csvJson) {
            this.csvJson = csvJson;
            return this;
        }

        public Builder objects(List<String> objects) {
            this.objects = new ArrayList<>(objects);
            return this;
        }

        public Bundle build() {
            return new Bundle(name, packageName, channelName, version, bundlePath, replaces, skips,
                    skipRange, substitutesFor, providedApis, requiredApis, properties, dependencies,
                    relatedImages, csvJson, objects);
        }
    }
}
