package de.bsommerfeld.catalog.cache.declcfg;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.catalog.core.error.InvalidCatalogException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed view of the objects of one or more packages of a declarative source
 * catalog. Objects of schemas other than package, channel and bundle are
 * carried along untouched in {@link #others()}.
 */
public record DeclarativeConfig(List<DeclPackage> packages, List<DeclChannel> channels,
        List<DeclBundle> bundles, List<Meta> others) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public DeclarativeConfig {
        packages = List.copyOf(packages);
        channels = List.copyOf(channels);
        bundles = List.copyOf(bundles);
        others = List.copyOf(others);
    }

    /**
     * Parses the given objects by schema.
     *
     * @throws InvalidCatalogException if a package, channel or bundle object
     *                                 does not have the expected shape
     */
    public static DeclarativeConfig parse(List<Meta> metas) throws InvalidCatalogException {
        List<DeclPackage> packages = new ArrayList<>();
        List<DeclChannel> channels = new ArrayList<>();
        List<DeclBundle> bundles = new ArrayList<>();
        List<Meta> others = new ArrayList<>();
        for (Meta meta : metas) {
            switch (meta.schema()) {
                case Meta.SCHEMA_PACKAGE:
                    packages.add(read(meta, DeclPackage.class, "package"));
                    break;
                case Meta.SCHEMA_CHANNEL:
                    channels.add(read(meta, DeclChannel.class, "channel"));
                    break;
                case Meta.SCHEMA_BUNDLE:
                    bundles.add(read(meta, DeclBundle.class, "bundle"));
                    break;
                default:
                    others.add(meta);
            }
        }
        return new DeclarativeConfig(packages, channels, bundles, others);
    }

    private static <T> T read(Meta meta, Class<T> type, String what) throws InvalidCatalogException {
        try {
            return MAPPER.readValue(meta.blob(), type);
        } catch (IOException e) {
            throw new InvalidCatalogException("parse " + what + ": " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DeclPackage(String name, String defaultChannel, String description) {

        public DeclPackage {
            name = name == null ? "" : name;
            defaultChannel = defaultChannel == null ? "" : defaultChannel;
            description = description == null ? "" : description;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DeclChannel(String name, @JsonProperty("package") String packageName, List<DeclEntry> entries) {

        public DeclChannel {
            name = name == null ? "" : name;
            packageName = packageName == null ? "" : packageName;
            entries = entries == null ? List.of() : List.copyOf(entries);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DeclEntry(String name, String replaces, List<String> skips, String skipRange) {

        public DeclEntry {
            name = name == null ? "" : name;
            replaces = replaces == null ? "" : replaces;
            skips = skips == null ? List.of() : List.copyOf(skips);
            skipRange = skipRange == null ? "" : skipRange;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DeclProperty(String type, JsonNode value) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DeclRelatedImage(String name, String image) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DeclBundle(String name, @JsonProperty("package") String packageName, String image,
            List<DeclProperty> properties, List<DeclRelatedImage> relatedImages) {

        public DeclBundle {
            name = name == null ? "" : name;
            packageName = packageName == null ? "" : packageName;
            image = image == null ? "" : image;
            properties = properties == null ? List.of() : List.copyOf(properties);
            relatedImages = relatedImages == null ? List.of() : List.copyOf(relatedImages);
        }
    }
}
