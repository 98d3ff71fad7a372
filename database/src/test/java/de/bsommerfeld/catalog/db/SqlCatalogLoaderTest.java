package de.bsommerfeld.catalog.db;

import de.bsommerfeld.catalog.core.error.BundleImageNotFoundException;
import de.bsommerfeld.catalog.core.error.CatalogException;
import de.bsommerfeld.catalog.core.error.DeprecationPolicyException;
import de.bsommerfeld.catalog.core.error.GraphStructureException;
import de.bsommerfeld.catalog.core.error.NotFoundException;
import de.bsommerfeld.catalog.core.error.UnsupportedFeatureException;
import de.bsommerfeld.catalog.core.graph.BundleKey;
import de.bsommerfeld.catalog.core.graph.ChannelGraph;
import de.bsommerfeld.catalog.core.graph.PackageGraph;
import de.bsommerfeld.catalog.core.model.Bundle;
import de.bsommerfeld.catalog.core.model.PackageChannel;
import de.bsommerfeld.catalog.core.model.Property;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static de.bsommerfeld.catalog.db.TestCatalogs.bundle;
import static de.bsommerfeld.catalog.db.TestCatalogs.count;
import static de.bsommerfeld.catalog.db.TestCatalogs.execute;
import static de.bsommerfeld.catalog.db.TestCatalogs.manifest;
import static de.bsommerfeld.catalog.db.TestCatalogs.minDepths;
import static de.bsommerfeld.catalog.db.TestCatalogs.path;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for SqlCatalogLoader against a real temporary SQLite
 * database, read back through SqlCatalogQuerier and plain SQL.
 */
class SqlCatalogLoaderTest {

    @TempDir
    Path tempDir;

    private SqliteDatabase db;
    private SqlCatalogLoader loader;
    private SqlCatalogQuerier querier;

    @BeforeEach
    void setUp() throws CatalogException {
        db = TestCatalogs.migrated(tempDir);
        loader = new SqlCatalogLoader(db, false);
        querier = new SqlCatalogQuerier(db);
    }

    // -- Channel Derivation --

    @Test
    void addPackageChannels_shouldResolveExampleScenario() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());
        loader.addBundle(bundle("acme.v2", "2.0.0").replaces("acme.v1").skips("acme.v1-rc1").build());
        loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.v2"));

        assertEquals("acme.v2", querier.getBundleForChannel("acme", "stable").name());
        assertEquals("acme.v2", querier.getBundleThatReplaces("acme.v1-rc1", "acme", "stable").name());
        assertEquals("acme.v2", querier.getBundleThatReplaces("acme.v1", "acme", "stable").name());

        Map<String, Integer> depths = minDepths(db, "acme", "stable");
        assertEquals(0, depths.get("acme.v2"));
        assertEquals(1, depths.get("acme.v1"));
        assertEquals(1, depths.get("acme.v1-rc1"));
    }

    @Test
    void addPackageChannels_shouldIncreaseDepthAlongChain() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());
        loader.addBundle(bundle("acme.v2", "2.0.0").replaces("acme.v1").build());
        loader.addBundle(bundle("acme.v3", "3.0.0").replaces("acme.v2").build());
        loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.v3"));

        Map<String, Integer> depths = minDepths(db, "acme", "stable");
        assertEquals(Map.of("acme.v3", 0, "acme.v2", 1, "acme.v1", 2), depths);
    }

    @Test
    void addPackageChannels_shouldPlaceLaterSkipsDeeper() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());
        loader.addBundle(bundle("acme.v2", "2.0.0").replaces("acme.v1").skips("acme.v1-rc1", "acme.v1-rc2")
                .build());
        loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.v2"));

        Map<String, Integer> depths = minDepths(db, "acme", "stable");
        assertEquals(1, depths.get("acme.v1-rc1"));
        assertEquals(2, depths.get("acme.v1-rc2"));
        assertEquals("acme.v2", querier.getBundleThatReplaces("acme.v1-rc2", "acme", "stable").name());
    }

    @Test
    void addPackageChannels_shouldRecordPackagePropertyForVisitedBundles() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());
        loader.addBundle(bundle("acme.v2", "2.0.0").replaces("acme.v1").build());
        loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.v2"));

        Bundle v1 = querier.getBundle("acme", "stable", "acme.v1");
        assertTrue(v1.properties().contains(Property.packageOf("acme", "1.0.0")));
    }

    @Test
    void addPackageChannels_shouldReplaceExistingChannels() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());
        loader.addBundle(bundle("acme.v2", "2.0.0").replaces("acme.v1").build());
        loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.v1", "beta", "acme.v1"));
        loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.v2"));

        List<PackageChannel> channels = querier.getPackage("acme").channels();
        assertEquals(List.of(new PackageChannel("stable", "acme.v2")), channels);
    }

    // -- Structural Errors --

    @Test
    void addPackageChannels_shouldRejectCycleWithoutPartialEntries() throws Exception {
        loader.addBundle(bundle("acme.a", "1.0.0").replaces("acme.b").build());
        loader.addBundle(bundle("acme.b", "2.0.0").replaces("acme.a").build());

        GraphStructureException e = assertThrows(GraphStructureException.class,
                () -> loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.a")));

        assertEquals(GraphStructureException.Kind.CYCLE, e.getKind());
        assertTrue(e.getMessage().contains("cycle detected"));
        assertEquals(0, count(db, "SELECT COUNT(*) FROM channel_entry WHERE channel_name = 'stable'"));
        assertEquals(0, count(db, "SELECT COUNT(*) FROM channel WHERE name = 'stable'"));
    }

    @Test
    void addPackageChannels_shouldCommitSiblingChannelsWhenOneIsMalformed() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());
        loader.addBundle(bundle("acme.v2", "2.0.0").replaces("acme.missing").build());

        GraphStructureException e = assertThrows(GraphStructureException.class,
                () -> loader.addPackageChannels(manifest("acme", "stable",
                        "stable", "acme.v1", "broken", "acme.v2")));

        assertEquals(GraphStructureException.Kind.DANGLING_REPLACES, e.getKind());
        assertEquals("broken", e.getChannelName());
        assertEquals("invalid bundle acme.v2, replaces nonexistent bundle acme.missing", e.getMessage());
        assertEquals("acme.v1", querier.getBundleForChannel("acme", "stable").name());
        assertEquals(1, querier.getPackage("acme").channels().size());
    }

    @Test
    void addPackageChannels_shouldReportMissingDefaultChannel() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());

        CatalogException e = assertThrows(CatalogException.class,
                () -> loader.addPackageChannels(manifest("acme", "", "stable", "acme.v1", "beta", "acme.v1")));

        assertEquals("no default channel specified for acme", e.getMessage());
        assertEquals(2, querier.getPackage("acme").channels().size());
    }

    @Test
    void addPackageChannels_shouldUseOnlyChannelAsDefault() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());
        loader.addPackageChannels(manifest("acme", "", "stable", "acme.v1"));

        assertEquals("stable", querier.getDefaultChannelForPackage("acme"));
    }

    @Test
    void addPackageChannels_shouldNotRecordDefaultMissingFromChannels() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());

        CatalogException e = assertThrows(CatalogException.class,
                () -> loader.addPackageChannels(manifest("acme", "alpha", "stable", "acme.v1")));

        assertEquals("no default channel specified for acme", e.getMessage());
        assertEquals("", querier.getDefaultChannelForPackage("acme"));
        assertEquals(List.of(new PackageChannel("stable", "acme.v1")), querier.getPackage("acme").channels());
    }

    // -- Tombstones --

    @Test
    void addPackageChannels_shouldElideChannelWithDeprecatedHead() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());
        loader.addBundle(bundle("acme.v2", "2.0.0").build());
        execute(db, "INSERT INTO deprecated (operatorbundle_name) VALUES (?)", "acme.v1");

        loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.v2", "old", "acme.v1"));

        assertEquals(List.of(new PackageChannel("stable", "acme.v2")), querier.getPackage("acme").channels());
    }

    @Test
    void addPackageChannels_shouldNotRecordDefaultWhenItsChannelIsElided() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());
        loader.addBundle(bundle("acme.v2", "2.0.0").build());
        execute(db, "INSERT INTO deprecated (operatorbundle_name) VALUES (?)", "acme.v1");

        CatalogException e = assertThrows(CatalogException.class,
                () -> loader.addPackageChannels(manifest("acme", "old", "stable", "acme.v2", "old", "acme.v1")));

        assertEquals("no default channel specified for acme", e.getMessage());
        assertEquals("", querier.getDefaultChannelForPackage("acme"));
        assertEquals(List.of(new PackageChannel("stable", "acme.v2")), querier.getPackage("acme").channels());
    }

    @Test
    void addPackageChannels_shouldStopAtTombstonedReplacesTarget() throws Exception {
        loader.addBundle(bundle("acme.v2", "2.0.0").replaces("acme.v1").build());
        execute(db, "INSERT INTO deprecated (operatorbundle_name) VALUES (?)", "acme.v1");

        loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.v2"));

        assertEquals(Map.of("acme.v2", 0), minDepths(db, "acme", "stable"));
    }

    // -- Bundles --

    @Test
    void addBundle_shouldRejectSubstitutesForWhenAlphaDisabled() {
        Bundle bundle = bundle("acme.v2-fix", "2.0.1").substitutesFor("acme.v2").build();

        UnsupportedFeatureException e = assertThrows(UnsupportedFeatureException.class,
                () -> loader.addBundle(bundle));
        assertEquals("SubstitutesFor is an alpha-only feature. You must enable alpha features with the flag "
                + "--enable-alpha in order to use this feature.", e.getMessage());
    }

    @Test
    void addBundle_shouldRejectDuplicateName() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());

        assertThrows(CatalogException.class, () -> loader.addBundle(bundle("acme.v1", "1.0.0").build()));
        assertEquals(1, count(db, "SELECT COUNT(*) FROM operatorbundle"));
    }

    @Test
    void addBundle_shouldDeduplicateFacts() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0")
                .provides(TestCatalogs.WIDGET)
                .property(Property.gvk(TestCatalogs.WIDGET))
                .build());

        assertEquals(1, count(db, "SELECT COUNT(*) FROM properties WHERE type = 'olm.gvk'"));
    }

    @Test
    void addBundle_shouldRecordRequiredApiAsDependency() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").requires(TestCatalogs.WIDGET).build());

        assertEquals(1, count(db, "SELECT COUNT(*) FROM dependencies WHERE type = 'olm.gvk'"));
        assertEquals(1, count(db, "SELECT COUNT(*) FROM api_requirer WHERE operatorbundle_name = 'acme.v1'"));
    }

    // -- Substitution --

    @Test
    void addBundle_shouldRedirectReplacersToSubstitute() throws Exception {
        SqlCatalogLoader alpha = new SqlCatalogLoader(db, true);
        alpha.addBundle(bundle("acme.v1", "1.0.0").build());
        alpha.addBundle(bundle("acme.v2", "2.0.0").replaces("acme.v1").build());
        alpha.addBundle(bundle("acme.v3", "3.0.0").replaces("acme.v2").build());
        alpha.addBundle(bundle("acme.v2-fix", "2.0.1").replaces("acme.v1").substitutesFor("acme.v2").build());
        alpha.addPackageChannels(manifest("acme", "stable", "stable", "acme.v3"));

        assertEquals("acme.v2-fix", querier.getBundle("acme", "stable", "acme.v3").replaces());
        assertEquals(List.of("acme.v2"), querier.getBundle("acme", "stable", "acme.v2-fix").skips());
        assertEquals("acme.v2-fix", querier.getBundleThatReplaces("acme.v2", "acme", "stable").name());
    }

    @Test
    void addBundle_shouldRedirectNewReplacesToLatestSubstitute() throws Exception {
        SqlCatalogLoader alpha = new SqlCatalogLoader(db, true);
        alpha.addBundle(bundle("acme.v1", "1.0.0").build());
        alpha.addBundle(bundle("acme.v1-fix", "1.0.1").substitutesFor("acme.v1").build());
        alpha.addBundle(bundle("acme.v2", "2.0.0").replaces("acme.v1").build());

        assertEquals(1, count(db, "SELECT COUNT(*) FROM operatorbundle WHERE name = 'acme.v2' "
                + "AND replaces = 'acme.v1-fix'"));
    }

    @Test
    void addBundle_shouldRejectSecondSubstitute() throws Exception {
        SqlCatalogLoader alpha = new SqlCatalogLoader(db, true);
        alpha.addBundle(bundle("acme.v1", "1.0.0").build());
        alpha.addBundle(bundle("acme.v1-fix", "1.0.1").substitutesFor("acme.v1").build());

        assertThrows(CatalogException.class,
                () -> alpha.addBundle(bundle("acme.v1-fix2", "1.0.2").substitutesFor("acme.v1").build()));
        assertEquals(0, count(db, "SELECT COUNT(*) FROM operatorbundle WHERE name = 'acme.v1-fix2'"));
    }

    // -- Combined --

    @Test
    void addBundlePackageChannels_shouldAddBundleAndChannelsTogether() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());
        loader.addBundlePackageChannels(manifest("acme", "stable", "stable", "acme.v2"),
                bundle("acme.v2", "2.0.0").replaces("acme.v1").build());

        assertEquals("acme.v2", querier.getBundleForChannel("acme", "stable").name());
    }

    @Test
    void addBundlePackageChannels_shouldRollBackBundleOnFailure() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());

        assertThrows(CatalogException.class, () -> loader.addBundlePackageChannels(
                manifest("acme", "stable", "stable", "acme.v1"), bundle("acme.v1", "1.0.0").build()));
        assertThrows(NotFoundException.class, () -> querier.getPackage("acme"));
    }

    // -- Package Graphs --

    @Test
    void addPackageGraph_shouldPersistGeneratedGraph() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());
        loader.addBundle(bundle("acme.v2", "2.0.0").replaces("acme.v1").build());
        loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.v2"));
        PackageGraph graph = new SqlGraphLoader(db).generate("acme");
        loader.removePackage("acme");
        loader.addBundle(bundle("acme.v1", "1.0.0").build());
        loader.addBundle(bundle("acme.v2", "2.0.0").replaces("acme.v1").build());

        loader.addPackageGraph(graph);

        assertEquals("acme.v2", querier.getBundleForChannel("acme", "stable").name());
        assertEquals("stable", querier.getDefaultChannelForPackage("acme"));
    }

    @Test
    void addPackageGraph_shouldRejectNodesUnreachableFromHead() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());
        loader.addBundle(bundle("acme.v2", "2.0.0").build());
        BundleKey v1 = new BundleKey(path("acme.v1"), "1.0.0", "acme.v1");
        BundleKey v2 = new BundleKey(path("acme.v2"), "2.0.0", "acme.v2");
        PackageGraph graph = new PackageGraph("acme", "stable",
                Map.of("stable", new ChannelGraph(v2, Map.of(v2, Set.of(), v1, Set.of()))));

        GraphStructureException e = assertThrows(GraphStructureException.class,
                () -> loader.addPackageGraph(graph));
        assertEquals(GraphStructureException.Kind.INVALID_GRAPH, e.getKind());
    }

    // -- Deprecation --

    @Test
    void deprecateBundle_shouldTruncateTailAndTombstone() throws Exception {
        addChain();

        loader.deprecateBundle(path("acme.v2"));

        assertEquals(0, count(db, "SELECT COUNT(*) FROM operatorbundle WHERE name = 'acme.v1'"));
        assertEquals(1, count(db, "SELECT COUNT(*) FROM deprecated WHERE operatorbundle_name = 'acme.v2'"));
        Bundle v2 = querier.getBundle("acme", "stable", "acme.v2");
        assertTrue(v2.properties().contains(Property.deprecated()));
        assertThrows(NotFoundException.class, () -> querier.getBundleThatReplaces("acme.v1", "acme", "stable"));
        assertEquals("acme.v3", querier.getBundleThatReplaces("acme.v2", "acme", "stable").name());
    }

    @Test
    void deprecateBundle_shouldKeepTailMemberWithOtherMemberships() throws Exception {
        addChain();
        loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.v3", "legacy", "acme.v1"));

        loader.deprecateBundle(path("acme.v2"));

        assertEquals("acme.v1", querier.getBundleForChannel("acme", "legacy").name());
        assertThrows(NotFoundException.class, () -> querier.getBundle("acme", "stable", "acme.v1"));
    }

    @Test
    void deprecateBundle_shouldDropChannelHeadedByDeprecatedBundle() throws Exception {
        addChain();
        loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.v3", "beta", "acme.v2"));

        loader.deprecateBundle(path("acme.v2"));

        assertEquals(List.of(new PackageChannel("stable", "acme.v3")), querier.getPackage("acme").channels());
    }

    @Test
    void deprecateBundle_shouldRejectDefaultChannelHead() throws Exception {
        addChain();

        assertThrows(DeprecationPolicyException.class, () -> loader.deprecateBundle(path("acme.v3")));
        assertEquals(0, count(db, "SELECT COUNT(*) FROM deprecated"));
    }

    @Test
    void deprecateBundle_shouldAllowTailContainingDefaultChannelHead() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());
        loader.addBundle(bundle("acme.v2", "2.0.0").replaces("acme.v1").build());
        loader.addPackageChannels(manifest("acme", "beta", "stable", "acme.v2", "beta", "acme.v1"));

        loader.deprecateBundle(path("acme.v2"));

        assertEquals(1, count(db, "SELECT COUNT(*) FROM deprecated WHERE operatorbundle_name = 'acme.v2'"));
        assertEquals(List.of(new PackageChannel("beta", "acme.v1")), querier.getPackage("acme").channels());
        assertEquals("beta", querier.getDefaultChannelForPackage("acme"));
        assertEquals("acme.v1", querier.getBundleForChannel("acme", "beta").name());
    }

    @Test
    void deprecateBundle_shouldThrowForUnknownPath() {
        BundleImageNotFoundException e = assertThrows(BundleImageNotFoundException.class,
                () -> loader.deprecateBundle("quay.io/acme/unknown:latest"));
        assertEquals("quay.io/acme/unknown:latest", e.getBundlePath());
    }

    @Test
    void deprecateBundle_shouldElideChannelOnReAdd() throws Exception {
        addChain();
        loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.v3", "beta", "acme.v2"));
        loader.deprecateBundle(path("acme.v2"));

        loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.v3", "beta", "acme.v2"));

        assertEquals(1, querier.getPackage("acme").channels().size());
    }

    // -- Removal --

    @Test
    void removePackage_shouldDeleteBundlesAndChannels() throws Exception {
        addChain();

        loader.removePackage("acme");

        assertTrue(querier.listPackages().isEmpty());
        assertEquals(0, count(db, "SELECT COUNT(*) FROM operatorbundle"));
        assertEquals(0, count(db, "SELECT COUNT(*) FROM channel_entry"));
        assertEquals(0, count(db, "SELECT COUNT(*) FROM properties"));
    }

    @Test
    void removePackage_shouldThrowNotFoundForUnknownPackage() {
        assertThrows(NotFoundException.class, () -> loader.removePackage("nope"));
    }

    @Test
    void removeStrandedBundles_shouldDeleteUnreferencedBundles() throws Exception {
        addChain();
        loader.addBundle(bundle("acme.orphan", "0.1.0").build());
        loader.addBundle(bundle("acme.tombstoned", "0.2.0").build());
        execute(db, "INSERT INTO deprecated (operatorbundle_name) VALUES (?)", "acme.tombstoned");

        assertEquals(1, loader.removeStrandedBundles());

        assertEquals(0, count(db, "SELECT COUNT(*) FROM operatorbundle WHERE name = 'acme.orphan'"));
        assertEquals(1, count(db, "SELECT COUNT(*) FROM operatorbundle WHERE name = 'acme.tombstoned'"));
        assertEquals(3, count(db, "SELECT COUNT(*) FROM operatorbundle WHERE name LIKE 'acme.v%'"));
    }

    @Test
    void clearNonHeadBundles_shouldDropContentOfNonHeads() throws Exception {
        loader.addBundle(bundle("acme.v1", "1.0.0").csvJson("{\"kind\":\"ClusterServiceVersion\"}").build());
        loader.addBundle(bundle("acme.v2", "2.0.0").replaces("acme.v1")
                .csvJson("{\"kind\":\"ClusterServiceVersion\"}").build());
        loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.v2"));

        loader.clearNonHeadBundles();

        assertEquals("", querier.getBundle("acme", "stable", "acme.v1").csvJson());
        assertFalse(querier.getBundle("acme", "stable", "acme.v2").csvJson().isEmpty());
    }

    private void addChain() throws CatalogException {
        loader.addBundle(bundle("acme.v1", "1.0.0").build());
        loader.addBundle(bundle("acme.v2", "2.0.0").replaces("acme.v1").build());
        loader.addBundle(bundle("acme.v3", "3.0.0").replaces("acme.v2").build());
        loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.v3"));
    }
}
