package de.bsommerfeld.catalog.core.graph;

import java.util.Map;
import java.util.Set;

/**
 * Replacement DAG of one channel.
 *
 * @param head  the only node no other node replaces
 * @param nodes every node mapped to the nodes it replaces, skip edges
 *              included
 */
public record ChannelGraph(BundleKey head, Map<BundleKey, Set<BundleKey>> nodes) {

    public ChannelGraph {
        nodes = Map.copyOf(nodes);
    }

    public Set<BundleKey> predecessors(BundleKey key) {
        return nodes.getOrDefault(key, Set.of());
    }
}
