package de.bsommerfeld.catalog.cache.declcfg;

import de.bsommerfeld.catalog.cache.index.CachedPackage;
import de.bsommerfeld.catalog.core.model.Bundle;

import java.util.List;

/**
 * A validated package: its index summary plus every bundle, once per channel
 * membership, with the channel set.
 */
public record ConvertedPackage(CachedPackage summary, List<Bundle> bundles) {

    public ConvertedPackage {
        bundles = List.copyOf(bundles);
    }
}
