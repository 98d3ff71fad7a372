/**
 * Relational catalog store: SQLite-backed in production, a temporary file in
 * TEST mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   BatchLoader / CatalogDeprecator
 *        │
 *        ▼
 *   CatalogLoader      ← interface, write side
 *        │
 *   SqlCatalogLoader   SqlGraphLoader   SqlCatalogQuerier
 *        └─────────────────┼────────────────┘
 *                          ▼
 *                   SqliteDatabase  ← Migrator keeps the schema current
 * </pre>
 *
 * <h2>Channel Entries</h2>
 * A channel is a chain of {@code channel_entry} rows linked by
 * {@code replaces} (an entry id). Skips add placeholder rows so that the
 * skipping bundle also "replaces" every bundle it skips.
 *
 * <pre>
 *   acme.v2 (replaces acme.v1, skips acme.v1-rc1), channel "stable"
 *
 *   entry  bundle        depth  replaces
 *   ─────  ────────────  ─────  ────────
 *     1    acme.v2         0       4
 *     2    acme.v1-rc1     1       -      placeholder for the skip
 *     3    acme.v2         1       2      skip edge
 *     4    acme.v1         1       -
 * </pre>
 *
 * <h2>Tables</h2>
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────────┐
 * │ operatorbundle                                                    │
 * ├──────────────────┬───────────────────────────────────────────────┤
 * │ name (PK)        │ CSV name, unique across the catalog           │
 * │ csv, bundle      │ Manifest content, NULL once trimmed           │
 * │ bundlepath       │ Image the content can be fetched from         │
 * │ replaces, skips  │ Declared predecessors, skips comma-separated  │
 * │ substitutesfor   │ Alpha: bundle this one stands in for          │
 * └──────────────────┴───────────────────────────────────────────────┘
 *
 *   package(name, default_channel)
 *   channel(name, package_name, head_operatorbundle_name)
 *   channel_entry(entry_id, channel_name, package_name, operatorbundle_name, replaces, depth)
 *   api / api_provider / api_requirer      provided and required GVKs
 *   properties / dependencies              typed JSON facts per bundle
 *   related_image                          images referenced per bundle
 *   deprecated(operatorbundle_name)        tombstones, outlive the bundle row
 *   schema_migrations(version, timestamp)  single row, -1 when empty
 * </pre>
 */
package de.bsommerfeld.catalog.db;
