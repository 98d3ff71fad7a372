package de.bsommerfeld.catalog.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.catalog.core.error.CatalogErrors;
import de.bsommerfeld.catalog.core.error.CatalogException;
import de.bsommerfeld.catalog.core.error.GraphStructureException;
import de.bsommerfeld.catalog.core.error.NotFoundException;
import de.bsommerfeld.catalog.core.graph.BundleKey;
import de.bsommerfeld.catalog.core.graph.ChannelGraph;
import de.bsommerfeld.catalog.core.graph.PackageGraph;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * {@link GraphLoader} over the relational store.
 *
 * <p>
 * Every channel entry contributes a node; an entry with a {@code replaces}
 * link contributes an edge to the entry it points at. The head is the one
 * real bundle of the channel that no edge points at. Placeholder nodes
 * created for skipped names never qualify as heads.
 */
@Singleton
public class SqlGraphLoader implements GraphLoader {

    private final SqliteDatabase db;

    @Inject
    public SqlGraphLoader(SqliteDatabase db) {
        this.db = db;
    }

    @Override
    public PackageGraph generate(String packageName) throws CatalogException {
        List<GraphStructureException> errors = new ArrayList<>();
        PackageGraph graph = generate(packageName, errors::add);
        CatalogErrors.throwIfAny(errors);
        return graph;
    }

    @Override
    public PackageGraph generate(String packageName, Consumer<GraphStructureException> onChannelError)
            throws CatalogException {
        try (Connection conn = db.getConnection()) {
            String defaultChannel = selectDefaultChannel(conn, packageName);
            Set<String> realBundles = selectRealBundles(conn, packageName);

            Map<String, Map<BundleKey, Set<BundleKey>>> nodesByChannel = new TreeMap<>();
            Map<String, Set<BundleKey>> candidatesByChannel = new TreeMap<>();
            Map<String, Set<BundleKey>> replacedByChannel = new TreeMap<>();

            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-annotated-entries"))) {
                ps.setString(1, packageName);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String channel = rs.getString("channel_name");
                        String name = rs.getString("operatorbundle_name");
                        BundleKey key = new BundleKey(rs.getString("bundlepath"), rs.getString("version"), name);

                        Set<BundleKey> predecessors = nodesByChannel
                                .computeIfAbsent(channel, c -> new LinkedHashMap<>())
                                .computeIfAbsent(key, k -> new LinkedHashSet<>());
                        if (realBundles.contains(name)) {
                            candidatesByChannel.computeIfAbsent(channel, c -> new LinkedHashSet<>()).add(key);
                        }

                        String replaces = rs.getString("replaces_name");
                        if (replaces != null) {
                            BundleKey replaced = new BundleKey(rs.getString("replaces_path"),
                                    rs.getString("replaces_version"), replaces);
                            predecessors.add(replaced);
                            replacedByChannel.computeIfAbsent(channel, c -> new HashSet<>()).add(replaced);
                        }
                    }
                }
            }

            Map<String, ChannelGraph> channels = new LinkedHashMap<>();
            for (Map.Entry<String, Map<BundleKey, Set<BundleKey>>> channel : nodesByChannel.entrySet()) {
                Set<BundleKey> candidates = new LinkedHashSet<>(
                        candidatesByChannel.getOrDefault(channel.getKey(), Set.of()));
                candidates.removeAll(replacedByChannel.getOrDefault(channel.getKey(), Set.of()));

                if (candidates.isEmpty()) {
                    onChannelError.accept(new GraphStructureException(GraphStructureException.Kind.NO_HEAD,
                            packageName, channel.getKey(), "no channel head found for " + channel.getKey()));
                } else if (candidates.size() > 1) {
                    onChannelError.accept(new GraphStructureException(GraphStructureException.Kind.MULTIPLE_HEADS,
                            packageName, channel.getKey(), "multiple candidate channel heads found for "
                                    + channel.getKey() + ": " + candidates.stream().map(BundleKey::csvName)
                                            .collect(Collectors.joining(", "))));
                } else {
                    channels.put(channel.getKey(),
                            new ChannelGraph(candidates.iterator().next(), channel.getValue()));
                }
            }
            return new PackageGraph(packageName, defaultChannel, channels);
        } catch (SQLException e) {
            throw new CatalogException("Failed to load graph of package " + packageName, e);
        }
    }

    private String selectDefaultChannel(Connection conn, String packageName) throws SQLException,
            NotFoundException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-package-default-channel"))) {
            ps.setString(1, packageName);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new NotFoundException("package " + packageName + " not found");
                }
                String defaultChannel = rs.getString(1);
                return defaultChannel == null ? "" : defaultChannel;
            }
        }
    }

    private Set<String> selectRealBundles(Connection conn, String packageName) throws SQLException {
        Set<String> names = new HashSet<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-real-bundles-for-package"))) {
            ps.setString(1, packageName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    names.add(rs.getString("name"));
                }
            }
        }
        return names;
    }
}
