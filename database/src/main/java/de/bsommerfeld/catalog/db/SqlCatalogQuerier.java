package de.bsommerfeld.catalog.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Splitter;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.catalog.core.error.CatalogException;
import de.bsommerfeld.catalog.core.error.NotFoundException;
import de.bsommerfeld.catalog.core.model.Bundle;
import de.bsommerfeld.catalog.core.model.ChannelEntry;
import de.bsommerfeld.catalog.core.model.Dependency;
import de.bsommerfeld.catalog.core.model.GroupVersionKind;
import de.bsommerfeld.catalog.core.model.PackageChannel;
import de.bsommerfeld.catalog.core.model.PackageManifest;
import de.bsommerfeld.catalog.core.model.Property;
import de.bsommerfeld.catalog.core.query.BundleSink;
import de.bsommerfeld.catalog.core.query.CatalogQuery;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link CatalogQuery} over the relational store.
 *
 * <p>
 * Replacement queries follow {@code channel_entry.replaces} links, so the
 * placeholder entries written for skips answer them the same way real
 * {@code replaces} edges do.
 */
@Singleton
public class SqlCatalogQuerier implements CatalogQuery {

    private static final Splitter SKIP_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SqliteDatabase db;

    @Inject
    public SqlCatalogQuerier(SqliteDatabase db) {
        this.db = db;
    }

    // =====================================================================
    // Packages
    // =====================================================================

    @Override
    public List<String> listPackages() throws CatalogException {
        try (Connection conn = db.getConnection()) {
            return selectStrings(conn, "select-packages");
        } catch (SQLException e) {
            throw new CatalogException("Failed to list packages", e);
        }
    }

    @Override
    public PackageManifest getPackage(String name) throws CatalogException {
        try (Connection conn = db.getConnection()) {
            String defaultChannel = selectDefaultChannel(conn, name);
            List<PackageChannel> channels = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-package-channels"))) {
                ps.setString(1, name);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        channels.add(new PackageChannel(rs.getString("name"),
                                rs.getString("head_operatorbundle_name")));
                    }
                }
            }
            return new PackageManifest(name, channels, defaultChannel);
        } catch (SQLException e) {
            throw new CatalogException("Failed to load package " + name, e);
        }
    }

    public String getDefaultChannelForPackage(String name) throws CatalogException {
        try (Connection conn = db.getConnection()) {
            return selectDefaultChannel(conn, name);
        } catch (SQLException e) {
            throw new CatalogException("Failed to load default channel of " + name, e);
        }
    }

    public List<String> getBundlePathsForPackage(String name) throws CatalogException {
        try (Connection conn = db.getConnection()) {
            selectDefaultChannel(conn, name);
            return selectStrings(conn, "select-bundle-paths-for-package", name);
        } catch (SQLException e) {
            throw new CatalogException("Failed to load bundle paths of " + name, e);
        }
    }

    public List<AnnotatedChannelEntry> getChannelEntriesFromPackage(String name) throws CatalogException {
        try (Connection conn = db.getConnection()) {
            selectDefaultChannel(conn, name);
            List<AnnotatedChannelEntry> entries = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-annotated-entries"))) {
                ps.setString(1, name);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        entries.add(new AnnotatedChannelEntry(rs.getString("package_name"),
                                rs.getString("channel_name"), rs.getString("operatorbundle_name"),
                                rs.getString("version"), rs.getString("bundlepath"), rs.getString("replaces_name"),
                                rs.getString("replaces_version"), rs.getString("replaces_path")));
                    }
                }
            }
            return entries;
        } catch (SQLException e) {
            throw new CatalogException("Failed to load channel entries of " + name, e);
        }
    }

    public List<ChannelHead> listChannelHeads() throws CatalogException {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-channel-heads"));
                ResultSet rs = ps.executeQuery()) {
            List<ChannelHead> heads = new ArrayList<>();
            while (rs.next()) {
                String channel = rs.getString("name");
                heads.add(new ChannelHead(rs.getString("package_name"), channel,
                        rs.getString("head_operatorbundle_name"), orEmpty(rs.getString("bundlepath")),
                        channel.equals(rs.getString("default_channel"))));
            }
            return heads;
        } catch (SQLException e) {
            throw new CatalogException("Failed to list channel heads", e);
        }
    }

    // =====================================================================
    // Bundles
    // =====================================================================

    @Override
    public Bundle getBundle(String pkg, String channel, String csvName) throws CatalogException {
        try (Connection conn = db.getConnection()) {
            return selectBundle(conn, pkg, channel, csvName);
        } catch (SQLException e) {
            throw new CatalogException("Failed to load bundle " + csvName, e);
        }
    }

    @Override
    public Bundle getBundleForChannel(String pkg, String channel) throws CatalogException {
        try (Connection conn = db.getConnection()) {
            List<String> heads = selectStrings(conn, "select-channel-head-name", pkg, channel);
            if (heads.isEmpty()) {
                throw new NotFoundException("channel " + channel + " not found in package " + pkg);
            }
            return selectBundle(conn, pkg, channel, heads.get(0));
        } catch (SQLException e) {
            throw new CatalogException("Failed to load head of " + pkg + "/" + channel, e);
        }
    }

    @Override
    public Bundle getBundleThatReplaces(String name, String pkg, String channel) throws CatalogException {
        try (Connection conn = db.getConnection()) {
            List<String> replacers = selectStrings(conn, "select-bundle-that-replaces", name, pkg, channel);
            if (replacers.isEmpty()) {
                throw new NotFoundException(String.format("no entry found for %s %s that replaces %s",
                        pkg, channel, name));
            }
            return selectBundle(conn, pkg, channel, replacers.get(0));
        } catch (SQLException e) {
            throw new CatalogException("Failed to load bundle that replaces " + name, e);
        }
    }

    public String getBundleVersion(String image) throws CatalogException {
        try (Connection conn = db.getConnection()) {
            List<String> versions = selectStrings(conn, "select-bundle-version-for-image", image);
            if (versions.isEmpty()) {
                throw new NotFoundException("no bundle found for image " + image);
            }
            return orEmpty(versions.get(0));
        } catch (SQLException e) {
            throw new CatalogException("Failed to load bundle version of " + image, e);
        }
    }

    public List<RelatedImage> listImages() throws CatalogException {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-images"));
                ResultSet rs = ps.executeQuery()) {
            List<RelatedImage> images = new ArrayList<>();
            while (rs.next()) {
                images.add(new RelatedImage(rs.getString(1), rs.getString(2)));
            }
            return images;
        } catch (SQLException e) {
            throw new CatalogException("Failed to list images", e);
        }
    }

    @Override
    public void sendBundles(BundleSink sink) throws CatalogException, IOException {
        try (Connection conn = db.getConnection()) {
            List<String[]> memberships = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-bundle-memberships"));
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    memberships.add(new String[]{rs.getString(1), rs.getString(2), rs.getString(3)});
                }
            }
            for (String[] membership : memberships) {
                sink.send(selectBundle(conn, membership[0], membership[1], membership[2]).withoutContent());
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to stream bundles", e);
        }
    }

    // =====================================================================
    // Channel entries
    // =====================================================================

    @Override
    public List<ChannelEntry> getChannelEntriesThatReplace(String name) throws CatalogException {
        List<ChannelEntry> entries = new ArrayList<>();
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-entries-that-replace"))) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(new ChannelEntry(rs.getString("package_name"), rs.getString("channel_name"),
                            rs.getString("operatorbundle_name"), name));
                }
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to load entries that replace " + name, e);
        }
        if (entries.isEmpty()) {
            throw new NotFoundException("no channel entries found that replace " + name);
        }
        return entries;
    }

    @Override
    public List<ChannelEntry> getChannelEntriesThatProvide(GroupVersionKind gvk) throws CatalogException {
        return selectProviders("select-entries-that-provide", gvk);
    }

    @Override
    public List<ChannelEntry> getLatestChannelEntriesThatProvide(GroupVersionKind gvk) throws CatalogException {
        return selectProviders("select-latest-entries-that-provide", gvk);
    }

    @Override
    public Bundle getBundleThatProvides(GroupVersionKind gvk) throws CatalogException {
        for (ChannelEntry entry : getLatestChannelEntriesThatProvide(gvk)) {
            if (entry.channelName().equals(getDefaultChannelForPackage(entry.packageName()))) {
                return getBundle(entry.packageName(), entry.channelName(), entry.bundleName());
            }
        }
        throw new NotFoundException("no bundle found that provides " + gvk);
    }

    private List<ChannelEntry> selectProviders(String sql, GroupVersionKind gvk) throws CatalogException {
        List<ChannelEntry> entries = new ArrayList<>();
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sql))) {
            ps.setString(1, Property.TYPE_GVK);
            ps.setString(2, Property.gvkValue(gvk));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(new ChannelEntry(rs.getString("package_name"), rs.getString("channel_name"),
                            rs.getString("operatorbundle_name"), rs.getString("replaces_name")));
                }
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to load entries that provide " + gvk, e);
        }
        if (entries.isEmpty()) {
            throw new NotFoundException("no channel entries found that provide " + gvk);
        }
        return entries;
    }

    // =====================================================================
    // Mapping
    // =====================================================================

    private Bundle selectBundle(Connection conn, String pkg, String channel, String name)
            throws SQLException, CatalogException {
        Bundle.Builder builder;
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-bundle-in-channel"))) {
            ps.setString(1, pkg);
            ps.setString(2, channel);
            ps.setString(3, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new NotFoundException(String.format("bundle %s not found in %s/%s", name, pkg, channel));
                }
                builder = mapBundle(rs).packageName(pkg).channelName(channel);
            }
        }

        builder.providedApis(selectApis(conn, "select-provided-apis", name));
        builder.requiredApis(selectApis(conn, "select-required-apis", name));
        builder.relatedImages(selectStrings(conn, "select-bundle-related-images", name));

        List<Property> properties = new ArrayList<>();
        for (String[] row : selectPairs(conn, "select-bundle-properties", name)) {
            properties.add(new Property(row[0], row[1]));
        }
        builder.properties(properties);

        List<Dependency> dependencies = new ArrayList<>();
        for (String[] row : selectPairs(conn, "select-bundle-dependencies", name)) {
            dependencies.add(new Dependency(row[0], row[1]));
        }
        builder.dependencies(dependencies);
        return builder.build();
    }

    private Bundle.Builder mapBundle(ResultSet rs) throws SQLException {
        return Bundle.builder(rs.getString("name"))
                .csvJson(rs.getString("csv"))
                .objects(decodeObjects(rs.getString("bundle")))
                .bundlePath(rs.getString("bundlepath"))
                .version(rs.getString("version"))
                .skipRange(rs.getString("skiprange"))
                .replaces(rs.getString("replaces"))
                .skips(SKIP_SPLITTER.splitToList(orEmpty(rs.getString("skips"))))
                .substitutesFor(rs.getString("substitutesfor"));
    }

    private List<GroupVersionKind> selectApis(Connection conn, String sql, String name) throws SQLException {
        List<GroupVersionKind> apis = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sql))) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    apis.add(new GroupVersionKind(rs.getString("group_name"), rs.getString("version"),
                            rs.getString("kind"), rs.getString("plural")));
                }
            }
        }
        return apis;
    }

    private String selectDefaultChannel(Connection conn, String name) throws SQLException, NotFoundException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-package-default-channel"))) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new NotFoundException("package " + name + " not found");
                }
                return orEmpty(rs.getString(1));
            }
        }
    }

    private List<String> selectStrings(Connection conn, String sql, String... params) throws SQLException {
        List<String> values = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sql))) {
            for (int i = 0; i < params.length; i++) {
                ps.setString(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    values.add(rs.getString(1));
                }
            }
        }
        return values;
    }

    private List<String[]> selectPairs(Connection conn, String sql, String param) throws SQLException {
        List<String[]> rows = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sql))) {
            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new String[]{rs.getString(1), rs.getString(2)});
                }
            }
        }
        return rows;
    }

    private static List<String> decodeObjects(String json) throws SQLException {
        if (json == null || json.isEmpty()) {
            return List.of();
        }
        try {
            List<String> objects = new ArrayList<>();
            for (JsonNode node : MAPPER.readTree(json)) {
                objects.add(MAPPER.writeValueAsString(node));
            }
            return objects;
        } catch (JsonProcessingException e) {
            throw new SQLException("Stored bundle objects are not valid JSON", e);
        }
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }
}
