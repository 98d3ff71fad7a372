package de.bsommerfeld.catalog.core.model;

/**
 * A channel as declared in a {@link PackageManifest}.
 *
 * @param name           channel name
 * @param currentCsvName name of the channel head bundle
 */
public record PackageChannel(String name, String currentCsvName) {
}
