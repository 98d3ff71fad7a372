package de.bsommerfeld.catalog.db;

/** An image referenced by a bundle, the bundle's own path included. */
public record RelatedImage(String image, String bundleName) {
}
