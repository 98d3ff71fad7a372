package de.bsommerfeld.catalog.db;

import de.bsommerfeld.catalog.core.config.BatchMode;
import de.bsommerfeld.catalog.core.error.AggregateException;
import de.bsommerfeld.catalog.core.error.CatalogException;
import de.bsommerfeld.catalog.core.error.DeprecationPolicyException;
import de.bsommerfeld.catalog.core.error.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static de.bsommerfeld.catalog.db.TestCatalogs.bundle;
import static de.bsommerfeld.catalog.db.TestCatalogs.count;
import static de.bsommerfeld.catalog.db.TestCatalogs.manifest;
import static de.bsommerfeld.catalog.db.TestCatalogs.path;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Batch deprecation against a real store (acme: stable v3 to v1 as default,
 * beta headed by v2) plus batch-mode behavior against mocks.
 */
class CatalogDeprecatorTest {

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

        loader.addBundle(bundle("acme.v1", "1.0.0").build());
        loader.addBundle(bundle("acme.v2", "2.0.0").replaces("acme.v1").build());
        loader.addBundle(bundle("acme.v3", "3.0.0").replaces("acme.v2").build());
        loader.addPackageChannels(manifest("acme", "stable", "stable", "acme.v3", "beta", "acme.v2"));
    }

    // -- Package Level --

    @Test
    void deprecate_shouldRejectDefaultHeadWithoutOtherHeads() {
        CatalogDeprecator deprecator = new CatalogDeprecator(loader, querier, BatchMode.PERMISSIVE);

        DeprecationPolicyException e = assertThrows(DeprecationPolicyException.class,
                () -> deprecator.deprecate(List.of(path("acme.v3"))));
        assertEquals("cannot deprecate default channel head from package without removing all other channel "
                + "heads in package acme: must deprecate acme.v2, head of channel beta", e.getMessage());
    }

    @Test
    void deprecate_shouldRemovePackageWhenEveryHeadIsDeprecated() throws Exception {
        CatalogDeprecator deprecator = new CatalogDeprecator(loader, querier, BatchMode.PERMISSIVE);

        deprecator.deprecate(List.of(path("acme.v3"), path("acme.v2")));

        assertThrows(NotFoundException.class, () -> querier.getPackage("acme"));
        assertEquals(0, count(db, "SELECT COUNT(*) FROM operatorbundle"));
    }

    @Test
    void deprecate_shouldRemoveSingleChannelPackageWithItsHead() throws Exception {
        loader.addBundle(bundle("zeta.v1", "1.0.0").build());
        loader.addPackageChannels(manifest("zeta", "stable", "stable", "zeta.v1"));
        CatalogDeprecator deprecator = new CatalogDeprecator(loader, querier, BatchMode.PERMISSIVE);

        deprecator.deprecate(List.of(path("zeta.v1")));

        assertEquals(List.of("acme"), querier.listPackages());
    }

    // -- Bundle Level --

    @Test
    void deprecate_shouldDeprecateNonDefaultBundles() throws Exception {
        CatalogDeprecator deprecator = new CatalogDeprecator(loader, querier, BatchMode.PERMISSIVE);

        deprecator.deprecate(List.of(path("acme.v2")));

        assertEquals(1, count(db, "SELECT COUNT(*) FROM deprecated WHERE operatorbundle_name = 'acme.v2'"));
        assertEquals(1, querier.getPackage("acme").channels().size());
    }

    @Test
    void deprecate_shouldIgnoreUnknownPaths() {
        CatalogDeprecator deprecator = new CatalogDeprecator(loader, querier, BatchMode.STRICT);

        assertDoesNotThrow(() -> deprecator.deprecate(List.of("quay.io/acme/gone:latest")));
    }

    // -- Batch Modes --

    @Test
    void deprecate_shouldStopAtFirstErrorInStrictMode() throws Exception {
        CatalogLoader mockLoader = mock(CatalogLoader.class);
        SqlCatalogQuerier mockQuerier = mock(SqlCatalogQuerier.class);
        when(mockQuerier.listChannelHeads()).thenReturn(List.of());
        doThrow(new CatalogException("boom")).when(mockLoader).deprecateBundle("a");

        CatalogDeprecator deprecator = new CatalogDeprecator(mockLoader, mockQuerier, BatchMode.STRICT);

        assertThrows(CatalogException.class, () -> deprecator.deprecate(List.of("a", "b")));
        verify(mockLoader, never()).deprecateBundle("b");
    }

    @Test
    void deprecate_shouldAggregateErrorsInPermissiveMode() throws Exception {
        CatalogLoader mockLoader = mock(CatalogLoader.class);
        SqlCatalogQuerier mockQuerier = mock(SqlCatalogQuerier.class);
        when(mockQuerier.listChannelHeads()).thenReturn(List.of());
        doThrow(new CatalogException("first")).when(mockLoader).deprecateBundle("a");
        doThrow(new CatalogException("second")).when(mockLoader).deprecateBundle("b");

        CatalogDeprecator deprecator = new CatalogDeprecator(mockLoader, mockQuerier, BatchMode.PERMISSIVE);

        AggregateException e = assertThrows(AggregateException.class,
                () -> deprecator.deprecate(List.of("a", "b", "c")));
        assertEquals(2, e.getErrors().size());
        verify(mockLoader).deprecateBundle("c");
    }
}
