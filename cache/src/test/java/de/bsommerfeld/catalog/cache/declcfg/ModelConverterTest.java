package de.bsommerfeld.catalog.cache.declcfg;

import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bsommerfeld.catalog.cache.index.CachedChannel;
import de.bsommerfeld.catalog.cache.index.CachedPackage;
import de.bsommerfeld.catalog.core.error.InvalidCatalogException;
import de.bsommerfeld.catalog.core.model.Bundle;
import de.bsommerfeld.catalog.core.model.Dependency;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static de.bsommerfeld.catalog.cache.TestSources.CONFIG;
import static de.bsommerfeld.catalog.cache.TestSources.CRD;
import static de.bsommerfeld.catalog.cache.TestSources.CSV;
import static de.bsommerfeld.catalog.cache.TestSources.WIDGET;
import static de.bsommerfeld.catalog.cache.TestSources.bundle;
import static de.bsommerfeld.catalog.cache.TestSources.channel;
import static de.bsommerfeld.catalog.cache.TestSources.entry;
import static de.bsommerfeld.catalog.cache.TestSources.gvk;
import static de.bsommerfeld.catalog.cache.TestSources.gvkRequired;
import static de.bsommerfeld.catalog.cache.TestSources.image;
import static de.bsommerfeld.catalog.cache.TestSources.object;
import static de.bsommerfeld.catalog.cache.TestSources.pkg;
import static org.junit.jupiter.api.Assertions.*;

class ModelConverterTest {

    private final ModelConverter converter = new ModelConverter();

    private static DeclarativeConfig config(ObjectNode... objects) throws Exception {
        List<Meta> metas = new ArrayList<>();
        for (ObjectNode object : objects) {
            metas.add(CatalogWalker.toMeta(object));
        }
        return DeclarativeConfig.parse(metas);
    }

    private static String message(DeclarativeConfig config) {
        return assertThrows(InvalidCatalogException.class, () -> new ModelConverter().convert(config)).getMessage();
    }

    // -- Channels --

    @Test
    void convert_shouldFindHeadThroughReplacesAndSkips() throws Exception {
        List<ConvertedPackage> converted = converter.convert(config(
                pkg("acme", "stable"),
                channel("acme", "stable", entry("acme.v1", null), entry("acme.v2", "acme.v1", "acme.v1-rc1")),
                bundle("acme", "acme.v1", "1.0.0"),
                bundle("acme", "acme.v2", "2.0.0")));

        CachedPackage summary = converted.get(0).summary();
        CachedChannel stable = summary.channels().get("stable");
        assertEquals("stable", summary.defaultChannel());
        assertEquals("acme.v2", stable.head());
        assertEquals(List.of("acme.v1-rc1"), stable.bundles().get("acme.v2").skips());
    }

    @Test
    void convert_shouldEmitOneBundlePerChannelMembership() throws Exception {
        List<ConvertedPackage> converted = converter.convert(config(
                pkg("acme", "stable"),
                channel("acme", "stable", entry("acme.v1", null)),
                channel("acme", "beta", entry("acme.v1", null)),
                bundle("acme", "acme.v1", "1.0.0")));

        List<Bundle> bundles = converted.get(0).bundles();
        assertEquals(2, bundles.size());
        assertEquals("beta", bundles.get(0).channelName());
        assertEquals("stable", bundles.get(1).channelName());
    }

    @Test
    void convert_shouldRejectMultipleHeads() throws Exception {
        DeclarativeConfig config = config(
                pkg("acme", "stable"),
                channel("acme", "stable", entry("acme.v1", null), entry("acme.v2", null)),
                bundle("acme", "acme.v1", "1.0.0"),
                bundle("acme", "acme.v2", "2.0.0"));

        assertEquals("package \"acme\", channel \"stable\": multiple channel heads found in graph: acme.v1, acme.v2",
                message(config));
    }

    @Test
    void convert_shouldRejectChannelWithoutHead() throws Exception {
        DeclarativeConfig config = config(
                pkg("acme", "stable"),
                channel("acme", "stable", entry("acme.v1", "acme.v2"), entry("acme.v2", "acme.v1")),
                bundle("acme", "acme.v1", "1.0.0"),
                bundle("acme", "acme.v2", "2.0.0"));

        assertEquals("package \"acme\", channel \"stable\": no channel head found in graph", message(config));
    }

    @Test
    void convert_shouldRejectDuplicateEntries() throws Exception {
        DeclarativeConfig config = config(
                pkg("acme", "stable"),
                channel("acme", "stable", entry("acme.v1", null), entry("acme.v1", null)),
                bundle("acme", "acme.v1", "1.0.0"));

        assertEquals("invalid package \"acme\", channel \"stable\": duplicate entry \"acme.v1\"", message(config));
    }

    @Test
    void convert_shouldRejectMissingDefaultChannel() throws Exception {
        DeclarativeConfig config = config(
                pkg("acme", "alpha"),
                channel("acme", "stable", entry("acme.v1", null)),
                bundle("acme", "acme.v1", "1.0.0"));

        assertEquals("package \"acme\": default channel \"alpha\" not found in channels list", message(config));
    }

    // -- Packages and Bundles --

    @Test
    void convert_shouldRejectDuplicatePackages() throws Exception {
        assertEquals("duplicate package \"acme\"", message(config(pkg("acme", "stable"), pkg("acme", "stable"))));
    }

    @Test
    void convert_shouldRejectChannelOfUnknownPackage() throws Exception {
        assertEquals("unknown package \"zeta\" for channel \"stable\"",
                message(config(pkg("acme", "stable"), channel("zeta", "stable", entry("z.v1", null)))));
    }

    @Test
    void convert_shouldRejectEntryWithoutBundle() throws Exception {
        DeclarativeConfig config = config(
                pkg("acme", "stable"),
                channel("acme", "stable", entry("acme.v1", null)));

        assertEquals("no olm.bundle blobs found in package \"acme\" for olm.channel entries [acme.v1]",
                message(config));
    }

    @Test
    void convert_shouldRejectBundleOutsideAnyChannel() throws Exception {
        DeclarativeConfig config = config(
                pkg("acme", "stable"),
                channel("acme", "stable", entry("acme.v1", null)),
                bundle("acme", "acme.v1", "1.0.0"),
                bundle("acme", "acme.v9", "9.0.0"));

        assertEquals("package \"acme\", bundle \"acme.v9\" not found in any channel entries", message(config));
    }

    @Test
    void convert_shouldRejectMismatchedPackageProperty() throws Exception {
        ObjectNode stray = bundle("zeta", "acme.v1", "1.0.0");
        stray.put("package", "acme");

        DeclarativeConfig config = config(
                pkg("acme", "stable"),
                channel("acme", "stable", entry("acme.v1", null)),
                stray);

        assertEquals("package \"acme\" does not match \"olm.package\" property \"zeta\"", message(config));
    }

    // -- Bundle Conversion --

    @Test
    void convert_shouldMapPropertiesToApisDependenciesAndObjects() throws Exception {
        List<ConvertedPackage> converted = converter.convert(config(
                pkg("acme", "stable"),
                channel("acme", "stable", entry("acme.v2", null, "acme.v1")),
                bundle("acme", "acme.v2", "2.0.0", gvk(WIDGET), gvkRequired(CONFIG), object(CRD), object(CSV))));

        Bundle v2 = converted.get(0).bundles().get(0);
        assertEquals("2.0.0", v2.version());
        assertEquals(image("acme.v2"), v2.bundlePath());
        assertEquals(List.of("acme.v1"), v2.skips());
        assertTrue(v2.provides(WIDGET));
        assertEquals(1, v2.requiredApis().size());
        assertTrue(v2.requiredApis().get(0).sameType(CONFIG));
        assertEquals(Dependency.gvk(CONFIG), v2.dependencies().get(0));
        assertEquals(List.of(CRD, CSV), v2.objects());
        assertEquals(CSV, v2.csvJson());
    }

    @Test
    void parse_shouldKeepUnknownSchemasAsOpaqueObjects() throws Exception {
        ObjectNode custom = pkg("acme", "stable");
        custom.put("schema", "acme.custom");

        DeclarativeConfig config = config(pkg("acme", "stable"), custom);

        assertEquals(1, config.packages().size());
        assertEquals(1, config.others().size());
        assertEquals("acme.custom", config.others().get(0).schema());
    }
}
