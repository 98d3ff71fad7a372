package de.bsommerfeld.catalog.cache.declcfg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.BaseEncoding;
import de.bsommerfeld.catalog.cache.declcfg.DeclarativeConfig.DeclBundle;
import de.bsommerfeld.catalog.cache.declcfg.DeclarativeConfig.DeclChannel;
import de.bsommerfeld.catalog.cache.declcfg.DeclarativeConfig.DeclEntry;
import de.bsommerfeld.catalog.cache.declcfg.DeclarativeConfig.DeclPackage;
import de.bsommerfeld.catalog.cache.declcfg.DeclarativeConfig.DeclProperty;
import de.bsommerfeld.catalog.cache.declcfg.DeclarativeConfig.DeclRelatedImage;
import de.bsommerfeld.catalog.cache.index.CachedBundle;
import de.bsommerfeld.catalog.cache.index.CachedChannel;
import de.bsommerfeld.catalog.cache.index.CachedPackage;
import de.bsommerfeld.catalog.core.error.InvalidCatalogException;
import de.bsommerfeld.catalog.core.model.Bundle;
import de.bsommerfeld.catalog.core.model.Dependency;
import de.bsommerfeld.catalog.core.model.GroupVersionKind;
import de.bsommerfeld.catalog.core.model.Property;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Validates a {@link DeclarativeConfig} and converts it into package index
 * summaries and query-ready bundles.
 */
public class ModelConverter {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String CSV_KIND = "ClusterServiceVersion";

    /**
     * Converts every package of {@code config}, ordered by package name.
     *
     * @throws InvalidCatalogException on the first inconsistency found
     */
    public List<ConvertedPackage> convert(DeclarativeConfig config) throws InvalidCatalogException {
        Map<String, DeclPackage> packages = new TreeMap<>();
        for (DeclPackage p : config.packages()) {
            if (p.name().isEmpty()) {
                throw new InvalidCatalogException("config contains package with no name");
            }
            if (packages.putIfAbsent(p.name(), p) != null) {
                throw new InvalidCatalogException(String.format("duplicate package \"%s\"", p.name()));
            }
        }

        Map<String, Map<String, DeclChannel>> channels = new TreeMap<>();
        Map<String, Set<String>> unresolvedEntries = new TreeMap<>();
        for (DeclChannel c : config.channels()) {
            if (!packages.containsKey(c.packageName())) {
                throw new InvalidCatalogException(
                        String.format("unknown package \"%s\" for channel \"%s\"", c.packageName(), c.name()));
            }
            if (c.name().isEmpty()) {
                throw new InvalidCatalogException(
                        String.format("package \"%s\" contains channel with no name", c.packageName()));
            }
            Map<String, DeclChannel> pkgChannels = channels.computeIfAbsent(c.packageName(), k -> new TreeMap<>());
            if (pkgChannels.putIfAbsent(c.name(), c) != null) {
                throw new InvalidCatalogException(
                        String.format("package \"%s\" has duplicate channel \"%s\"", c.packageName(), c.name()));
            }
            Set<String> names = new HashSet<>();
            for (DeclEntry entry : c.entries()) {
                if (!names.add(entry.name())) {
                    throw new InvalidCatalogException(String.format(
                            "invalid package \"%s\", channel \"%s\": duplicate entry \"%s\"",
                            c.packageName(), c.name(), entry.name()));
                }
                unresolvedEntries.computeIfAbsent(c.packageName(), k -> new TreeSet<>()).add(entry.name());
            }
        }

        Map<String, Map<String, DeclBundle>> bundles = new TreeMap<>();
        Map<String, String> versions = new TreeMap<>();
        for (DeclBundle b : config.bundles()) {
            validateBundle(b, packages, channels, bundles);
            versions.put(b.packageName() + "/" + b.name(), versionOf(b));
            Set<String> unresolved = unresolvedEntries.get(b.packageName());
            if (unresolved != null) {
                unresolved.remove(b.name());
            }
        }
        for (Map.Entry<String, Set<String>> e : unresolvedEntries.entrySet()) {
            if (!e.getValue().isEmpty()) {
                throw new InvalidCatalogException(String.format(
                        "no olm.bundle blobs found in package \"%s\" for olm.channel entries %s",
                        e.getKey(), e.getValue()));
            }
        }

        List<ConvertedPackage> converted = new ArrayList<>();
        for (DeclPackage p : packages.values()) {
            Map<String, DeclChannel> pkgChannels = channels.getOrDefault(p.name(), Map.of());
            validateDefaultChannel(p, pkgChannels);

            Map<String, CachedChannel> summaries = new TreeMap<>();
            List<Bundle> pkgBundles = new ArrayList<>();
            for (DeclChannel c : pkgChannels.values()) {
                String head = headOf(c);
                Map<String, CachedBundle> members = new TreeMap<>();
                for (DeclEntry entry : c.entries()) {
                    members.put(entry.name(), new CachedBundle(p.name(), c.name(), entry.name(),
                            entry.replaces(), entry.skips()));
                }
                summaries.put(c.name(), new CachedChannel(c.name(), head, members));

                Map<String, DeclBundle> byName = bundles.getOrDefault(p.name(), Map.of());
                List<DeclEntry> entries = new ArrayList<>(c.entries());
                entries.sort((a, b) -> a.name().compareTo(b.name()));
                for (DeclEntry entry : entries) {
                    DeclBundle source = byName.get(entry.name());
                    pkgBundles.add(toBundle(source, c.name(), entry, versions.get(p.name() + "/" + entry.name())));
                }
            }
            converted.add(new ConvertedPackage(
                    new CachedPackage(p.name(), p.description(), p.defaultChannel(), summaries), pkgBundles));
        }
        return converted;
    }

    // =====================================================================
    // Validation
    // =====================================================================

    private static void validateBundle(DeclBundle b, Map<String, DeclPackage> packages,
            Map<String, Map<String, DeclChannel>> channels, Map<String, Map<String, DeclBundle>> bundles)
            throws InvalidCatalogException {
        if (b.packageName().isEmpty()) {
            throw new InvalidCatalogException(String.format("package name must be set for bundle \"%s\"", b.name()));
        }
        if (!packages.containsKey(b.packageName())) {
            throw new InvalidCatalogException(
                    String.format("unknown package \"%s\" for bundle \"%s\"", b.packageName(), b.name()));
        }
        Map<String, DeclBundle> pkgBundles = bundles.computeIfAbsent(b.packageName(), k -> new TreeMap<>());
        if (pkgBundles.putIfAbsent(b.name(), b) != null) {
            throw new InvalidCatalogException(
                    String.format("package \"%s\" has duplicate bundle \"%s\"", b.packageName(), b.name()));
        }

        List<JsonNode> packageProps = new ArrayList<>();
        for (DeclProperty property : b.properties()) {
            if (Property.TYPE_PACKAGE.equals(property.type())) {
                packageProps.add(property.value());
            }
        }
        if (packageProps.size() != 1) {
            throw new InvalidCatalogException(String.format(
                    "package \"%s\" bundle \"%s\" must have exactly 1 \"%s\" property, found %d",
                    b.packageName(), b.name(), Property.TYPE_PACKAGE, packageProps.size()));
        }
        String declared = packageProps.get(0) == null ? "" : packageProps.get(0).path("packageName").asText("");
        if (!b.packageName().equals(declared)) {
            throw new InvalidCatalogException(String.format("package \"%s\" does not match \"%s\" property \"%s\"",
                    b.packageName(), Property.TYPE_PACKAGE, declared));
        }

        boolean found = false;
        for (DeclChannel c : channels.getOrDefault(b.packageName(), Map.of()).values()) {
            for (DeclEntry entry : c.entries()) {
                found |= entry.name().equals(b.name());
            }
        }
        if (!found) {
            throw new InvalidCatalogException(String.format(
                    "package \"%s\", bundle \"%s\" not found in any channel entries", b.packageName(), b.name()));
        }
    }

    private static String versionOf(DeclBundle b) throws InvalidCatalogException {
        for (DeclProperty property : b.properties()) {
            if (Property.TYPE_PACKAGE.equals(property.type())) {
                String version = property.value() == null ? "" : property.value().path("version").asText("");
                if (version.isEmpty()) {
                    throw new InvalidCatalogException(
                            String.format("error parsing bundle \"%s\" version \"%s\"", b.name(), version));
                }
                return version;
            }
        }
        throw new IllegalStateException("bundle " + b.name() + " has no package property");
    }

    private static void validateDefaultChannel(DeclPackage p, Map<String, DeclChannel> channels)
            throws InvalidCatalogException {
        if (p.defaultChannel().isEmpty()) {
            throw new InvalidCatalogException(String.format("package \"%s\": default channel must be set", p.name()));
        }
        if (!channels.containsKey(p.defaultChannel())) {
            throw new InvalidCatalogException(String.format(
                    "package \"%s\": default channel \"%s\" not found in channels list",
                    p.name(), p.defaultChannel()));
        }
    }

    /** The single entry nothing in the channel replaces or skips. */
    static String headOf(DeclChannel c) throws InvalidCatalogException {
        Set<String> superseded = new HashSet<>();
        for (DeclEntry entry : c.entries()) {
            if (!entry.replaces().isEmpty()) {
                superseded.add(entry.replaces());
            }
            superseded.addAll(entry.skips());
        }
        Set<String> heads = new TreeSet<>();
        for (DeclEntry entry : c.entries()) {
            if (!superseded.contains(entry.name())) {
                heads.add(entry.name());
            }
        }
        if (heads.isEmpty()) {
            throw new InvalidCatalogException(String.format(
                    "package \"%s\", channel \"%s\": no channel head found in graph", c.packageName(), c.name()));
        }
        if (heads.size() > 1) {
            throw new InvalidCatalogException(String.format(
                    "package \"%s\", channel \"%s\": multiple channel heads found in graph: %s",
                    c.packageName(), c.name(), String.join(", ", heads)));
        }
        return heads.iterator().next();
    }

    // =====================================================================
    // Bundle conversion
    // =====================================================================

    private static Bundle toBundle(DeclBundle source, String channel, DeclEntry entry, String version)
            throws InvalidCatalogException {
        Bundle.Builder builder = Bundle.builder(source.name())
                .packageName(source.packageName())
                .channelName(channel)
                .version(version)
                .bundlePath(source.image())
                .replaces(entry.replaces())
                .skips(entry.skips())
                .skipRange(entry.skipRange());

        List<String> objects = new ArrayList<>();
        for (DeclProperty declared : source.properties()) {
            Property property = new Property(declared.type(), write(declared.value()));
            builder.property(property);
            switch (declared.type()) {
                case Property.TYPE_GVK:
                    builder.provides(Property.parseGvk(property.value()));
                    break;
                case Property.TYPE_GVK_REQUIRED:
                    GroupVersionKind gvk = Property.parseGvk(property.value());
                    builder.requires(gvk);
                    builder.dependency(Dependency.gvk(gvk));
                    break;
                case Property.TYPE_PACKAGE_REQUIRED:
                    builder.dependency(new Dependency(Dependency.TYPE_PACKAGE, property.value()));
                    break;
                case Property.TYPE_BUNDLE_OBJECT:
                    objects.add(decodeObject(source, declared.value()));
                    break;
                default:
                    break;
            }
        }
        builder.objects(objects);
        for (String object : objects) {
            if (CSV_KIND.equals(kindOf(source, object))) {
                builder.csvJson(object);
                break;
            }
        }

        List<String> images = new ArrayList<>();
        for (DeclRelatedImage image : source.relatedImages()) {
            images.add(image.image());
        }
        return builder.relatedImages(images).build();
    }

    private static String decodeObject(DeclBundle bundle, JsonNode value) throws InvalidCatalogException {
        String data = value == null ? "" : value.path("data").asText("");
        try {
            return new String(BaseEncoding.base64().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new InvalidCatalogException(String.format("package \"%s\", bundle \"%s\": get data for bundle object: %s",
                    bundle.packageName(), bundle.name(), e.getMessage()), e);
        }
    }

    private static String kindOf(DeclBundle bundle, String object) throws InvalidCatalogException {
        try {
            return MAPPER.readTree(object).path("kind").asText("");
        } catch (JsonProcessingException e) {
            throw new InvalidCatalogException(String.format("package \"%s\", bundle \"%s\": convert object to JSON: %s",
                    bundle.packageName(), bundle.name(), e.getOriginalMessage()), e);
        }
    }

    private static String write(JsonNode value) throws InvalidCatalogException {
        if (value == null) {
            return "";
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new InvalidCatalogException("encode property value: " + e.getOriginalMessage(), e);
        }
    }
}
