package de.bsommerfeld.catalog.db;

import de.bsommerfeld.catalog.core.error.AggregateException;
import de.bsommerfeld.catalog.core.error.CatalogException;
import de.bsommerfeld.catalog.core.error.GraphStructureException;
import de.bsommerfeld.catalog.core.error.NotFoundException;
import de.bsommerfeld.catalog.core.graph.BundleKey;
import de.bsommerfeld.catalog.core.graph.ChannelGraph;
import de.bsommerfeld.catalog.core.graph.PackageGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static de.bsommerfeld.catalog.db.TestCatalogs.bundle;
import static de.bsommerfeld.catalog.db.TestCatalogs.execute;
import static de.bsommerfeld.catalog.db.TestCatalogs.manifest;
import static de.bsommerfeld.catalog.db.TestCatalogs.path;
import static org.junit.jupiter.api.Assertions.*;

class SqlGraphLoaderTest {

    @TempDir
    Path tempDir;

    private SqliteDatabase db;
    private SqlCatalogLoader loader;
    private SqlGraphLoader graphLoader;

    @BeforeEach
    void setUp() throws CatalogException {
        db = TestCatalogs.migrated(tempDir);
        loader = new SqlCatalogLoader(db, false);
        graphLoader = new SqlGraphLoader(db);

        loader.addBundle(bundle("acme.v1", "1.0.0").build());
        loader.addBundle(bundle("acme.v2", "2.0.0").replaces("acme.v1").skips("acme.v1-rc1").build());
        loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.v2"));
    }

    // -- Heads --

    @Test
    void generate_shouldFindSingleHead() throws CatalogException {
        PackageGraph graph = graphLoader.generate("acme");

        assertEquals("acme", graph.name());
        assertEquals("stable", graph.defaultChannel());
        ChannelGraph stable = graph.channels().get("stable");
        assertEquals(new BundleKey(path("acme.v2"), "2.0.0", "acme.v2"), stable.head());
    }

    @Test
    void generate_shouldIncludeSkipEdges() throws CatalogException {
        ChannelGraph stable = graphLoader.generate("acme").channels().get("stable");

        Set<String> predecessors = stable.predecessors(stable.head()).stream()
                .map(BundleKey::csvName)
                .collect(Collectors.toSet());
        assertEquals(Set.of("acme.v1", "acme.v1-rc1"), predecessors);
    }

    @Test
    void generate_shouldThrowNotFoundForUnknownPackage() {
        assertThrows(NotFoundException.class, () -> graphLoader.generate("nope"));
    }

    // -- Malformed Channels --

    @Test
    void generate_shouldReportMultipleHeads() throws Exception {
        addBrokenChannel(false);

        GraphStructureException e = assertThrows(GraphStructureException.class,
                () -> graphLoader.generate("acme"));
        assertEquals(GraphStructureException.Kind.MULTIPLE_HEADS, e.getKind());
        assertEquals("broken", e.getChannelName());
    }

    @Test
    void generate_shouldReportMissingHead() throws Exception {
        addBrokenChannel(true);

        GraphStructureException e = assertThrows(GraphStructureException.class,
                () -> graphLoader.generate("acme"));
        assertEquals(GraphStructureException.Kind.NO_HEAD, e.getKind());
    }

    @Test
    void generate_shouldAggregateErrorsOfSeveralChannels() throws Exception {
        addBrokenChannel(false);
        execute(db, "INSERT INTO channel_entry (channel_name, package_name, operatorbundle_name, depth) "
                + "VALUES ('other', 'acme', 'acme.v1', 0), ('other', 'acme', 'acme.v2', 0)");

        AggregateException e = assertThrows(AggregateException.class, () -> graphLoader.generate("acme"));
        assertEquals(2, e.getErrors().size());
    }

    @Test
    void generate_withErrorConsumer_shouldOmitMalformedChannel() throws Exception {
        addBrokenChannel(false);
        List<GraphStructureException> errors = new ArrayList<>();

        PackageGraph graph = graphLoader.generate("acme", errors::add);

        assertEquals(Set.of("stable"), graph.channels().keySet());
        assertEquals(1, errors.size());
    }

    /** Two real bundles in one channel, optionally replacing each other. */
    private void addBrokenChannel(boolean cyclic) throws Exception {
        execute(db, "INSERT INTO channel_entry (entry_id, channel_name, package_name, operatorbundle_name, depth) "
                + "VALUES (100, 'broken', 'acme', 'acme.v1', 0), (101, 'broken', 'acme', 'acme.v2', 0)");
        if (cyclic) {
            execute(db, "UPDATE channel_entry SET replaces = 101 WHERE entry_id = 100");
            execute(db, "UPDATE channel_entry SET replaces = 100 WHERE entry_id = 101");
        }
    }
}
