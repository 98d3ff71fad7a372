package de.bsommerfeld.catalog.core.graph;

import java.util.Map;

/** In-memory replacement graph of a whole package, keyed by channel name. */
public record PackageGraph(String name, String defaultChannel, Map<String, ChannelGraph> channels) {

    public PackageGraph {
        channels = Map.copyOf(channels);
    }
}
