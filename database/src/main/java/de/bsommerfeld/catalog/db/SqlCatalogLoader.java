package de.bsommerfeld.catalog.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.catalog.core.config.DatabaseConfig;
import de.bsommerfeld.catalog.core.error.BundleImageNotFoundException;
import de.bsommerfeld.catalog.core.error.CatalogErrors;
import de.bsommerfeld.catalog.core.error.CatalogException;
import de.bsommerfeld.catalog.core.error.DeprecationPolicyException;
import de.bsommerfeld.catalog.core.error.GraphStructureException;
import de.bsommerfeld.catalog.core.error.NotFoundException;
import de.bsommerfeld.catalog.core.error.UnsupportedFeatureException;
import de.bsommerfeld.catalog.core.graph.BundleKey;
import de.bsommerfeld.catalog.core.graph.ChannelGraph;
import de.bsommerfeld.catalog.core.graph.PackageGraph;
import de.bsommerfeld.catalog.core.model.Bundle;
import de.bsommerfeld.catalog.core.model.Dependency;
import de.bsommerfeld.catalog.core.model.GroupVersionKind;
import de.bsommerfeld.catalog.core.model.PackageChannel;
import de.bsommerfeld.catalog.core.model.PackageManifest;
import de.bsommerfeld.catalog.core.model.Property;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * SQLite-backed {@link CatalogLoader}.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 *
 * <h3>Channel derivation</h3>
 * A channel is stored as a chain of {@code channel_entry} rows. The head sits
 * at depth 0; the real {@code replaces} target of an entry at depth d sits at
 * d+1. The k-th skip of a bundle at depth d yields a placeholder entry for
 * the skipped name and a second entry for the skipping bundle, both at depth
 * d+1+k, linked so that the skipping bundle "replaces" the skipped one.
 *
 * <h3>Transaction boundaries</h3>
 * One transaction per public method. Each channel is written under its own
 * savepoint so a malformed chain only discards that channel.
 *
 * @see SqlGraphLoader
 * @see SqlCatalogQuerier
 */
@Singleton
public class SqlCatalogLoader implements CatalogLoader {

    static final String ALPHA_SUBSTITUTES_FOR = "SubstitutesFor is an alpha-only feature. "
            + "You must enable alpha features with the flag --enable-alpha in order to use this feature.";

    private static final Logger LOG = LoggerFactory.getLogger(SqlCatalogLoader.class);
    private static final Splitter SKIP_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
    private static final Joiner SKIP_JOINER = Joiner.on(',');
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SqliteDatabase db;
    private final boolean enableAlpha;

    @Inject
    public SqlCatalogLoader(SqliteDatabase db, DatabaseConfig config) {
        this(db, config.isEnableAlpha());
    }

    public SqlCatalogLoader(SqliteDatabase db, boolean enableAlpha) {
        this.db = db;
        this.enableAlpha = enableAlpha;
    }

    // =====================================================================
    // Bundles
    // =====================================================================

    @Override
    public void addBundle(Bundle bundle) throws CatalogException {
        checkAlpha(bundle);
        inTransaction("add bundle " + bundle.name(), conn -> {
            insertBundle(conn, bundle);
            return List.of();
        });
        LOG.debug("Added bundle {}", bundle.name());
    }

    @Override
    public void addBundlePackageChannels(PackageManifest manifest, Bundle bundle) throws CatalogException {
        checkAlpha(bundle);
        inTransaction("add bundle " + bundle.name() + " to package " + manifest.packageName(), conn -> {
            insertBundle(conn, bundle);
            return writePackageChannels(conn, manifest);
        });
    }

    private void checkAlpha(Bundle bundle) throws UnsupportedFeatureException {
        if (!bundle.substitutesFor().isEmpty() && !enableAlpha) {
            throw new UnsupportedFeatureException(ALPHA_SUBSTITUTES_FOR);
        }
    }

    private void insertBundle(Connection conn, Bundle bundle) throws SQLException, CatalogException {
        if (exists(conn, "select-bundle-exists", bundle.name())) {
            throw new CatalogException("bundle " + bundle.name() + " already exists");
        }

        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-bundle"))) {
            ps.setString(1, bundle.name());
            ps.setString(2, nullIfEmpty(bundle.csvJson()));
            ps.setString(3, encodeObjects(bundle.objects()));
            ps.setString(4, bundle.bundlePath());
            ps.setString(5, bundle.version());
            ps.setString(6, bundle.skipRange());
            ps.setString(7, bundle.replaces());
            ps.setString(8, SKIP_JOINER.join(bundle.skips()));
            ps.setString(9, nullIfEmpty(bundle.substitutesFor()));
            ps.executeUpdate();
        }

        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-related-image"))) {
            for (String image : bundle.relatedImages()) {
                ps.setString(1, image);
                ps.setString(2, bundle.name());
                ps.addBatch();
            }
            ps.executeBatch();
        }

        for (Dependency dependency : bundle.dependencies()) {
            insertFact(conn, "insert-dependency", dependency.type(), dependency.value(), bundle);
        }
        for (GroupVersionKind api : bundle.requiredApis()) {
            Dependency dependency = Dependency.gvk(api);
            insertFact(conn, "insert-dependency", dependency.type(), dependency.value(), bundle);
            insertApi(conn, "insert-api-requirer", api, bundle);
        }

        for (Property property : bundle.properties()) {
            insertFact(conn, "insert-property", property.type(), property.value(), bundle);
        }
        for (GroupVersionKind api : bundle.providedApis()) {
            Property property = Property.gvk(api);
            insertFact(conn, "insert-property", property.type(), property.value(), bundle);
            insertApi(conn, "insert-api-provider", api, bundle);
        }
        if (isDeprecated(conn, bundle.name())) {
            Property property = Property.deprecated();
            insertFact(conn, "insert-property", property.type(), property.value(), bundle);
        }

        if (enableAlpha) {
            applySubstitution(conn, bundle);
        }
    }

    private void insertApi(Connection conn, String linkSql, GroupVersionKind api, Bundle bundle)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-api"))) {
            ps.setString(1, api.group());
            ps.setString(2, api.version());
            ps.setString(3, api.kind());
            ps.setString(4, api.plural());
            ps.executeUpdate();
        }
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(linkSql))) {
            ps.setString(1, api.group());
            ps.setString(2, api.version());
            ps.setString(3, api.kind());
            ps.setString(4, bundle.name());
            ps.setString(5, bundle.version());
            ps.setString(6, bundle.bundlePath());
            ps.executeUpdate();
        }
    }

    /** Inserts a property or dependency row unless the bundle already has it. */
    private void insertFact(Connection conn, String sql, String type, String value, Bundle bundle)
            throws SQLException {
        insertFact(conn, sql, type, value, bundle.name(), bundle.version(), bundle.bundlePath());
    }

    private void insertFact(Connection conn, String sql, String type, String value, String name, String version,
            String path) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sql))) {
            ps.setString(1, type);
            ps.setString(2, value);
            ps.setString(3, name);
            ps.setString(4, version);
            ps.setString(5, path);
            ps.executeUpdate();
        }
    }

    // =====================================================================
    // Substitution (alpha)
    // =====================================================================

    private void applySubstitution(Connection conn, Bundle bundle) throws SQLException, CatalogException {
        String replaces = bundle.replaces();
        List<String> skips = new ArrayList<>(bundle.skips());
        boolean changed = false;

        if (!replaces.isEmpty()) {
            String latest = latestSubstitute(conn, replaces, bundle.name());
            if (!latest.equals(replaces)) {
                replaces = latest;
                changed = true;
            }
        }

        String target = bundle.substitutesFor();
        if (!target.isEmpty()) {
            List<String> existing = selectNames(conn, "select-substitutes-for", target);
            existing.remove(bundle.name());
            if (!existing.isEmpty()) {
                throw new CatalogException("bundle " + target + " already has substitute " + existing.get(0));
            }

            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-replaces-to-substitute"))) {
                ps.setString(1, bundle.name());
                ps.setString(2, target);
                ps.setString(3, bundle.name());
                ps.executeUpdate();
            }

            Set<String> guard = new HashSet<>();
            String substituted = target;
            while (!substituted.isEmpty() && guard.add(substituted)) {
                if (!skips.contains(substituted)) {
                    skips.add(substituted);
                    changed = true;
                }
                substituted = selectSubstitution(conn, substituted);
            }
        }

        if (changed) {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-bundle-replaces-skips"))) {
                ps.setString(1, replaces);
                ps.setString(2, SKIP_JOINER.join(skips));
                ps.setString(3, bundle.name());
                ps.executeUpdate();
            }
            LOG.debug("Bundle {} now replaces '{}' and skips {}", bundle.name(), replaces, skips);
        }
    }

    private String latestSubstitute(Connection conn, String name, String exclude) throws SQLException {
        String current = name;
        Set<String> guard = new HashSet<>();
        while (guard.add(current)) {
            List<String> substitutes = selectNames(conn, "select-substitutes-for", current);
            substitutes.remove(exclude);
            if (substitutes.isEmpty()) {
                return current;
            }
            current = substitutes.get(substitutes.size() - 1);
        }
        return current;
    }

    private String selectSubstitution(Connection conn, String name) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-substitution"))) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? orEmpty(rs.getString(1)) : "";
            }
        }
    }

    // =====================================================================
    // Packages and channels
    // =====================================================================

    @Override
    public void addPackageChannels(PackageManifest manifest) throws CatalogException {
        inTransaction("add package " + manifest.packageName(), conn -> writePackageChannels(conn, manifest));
        LOG.debug("Added package {} with {} channel(s)", manifest.packageName(), manifest.channels().size());
    }

    private List<CatalogException> writePackageChannels(Connection conn, PackageManifest manifest)
            throws SQLException, CatalogException {
        String pkg = manifest.packageName();
        List<CatalogException> errors = new ArrayList<>();

        deletePackageRows(conn, pkg);
        update(conn, "insert-package", pkg);

        Set<String> written = new HashSet<>();
        for (PackageChannel channel : manifest.channels()) {
            if (isDeprecated(conn, channel.currentCsvName())) {
                LOG.debug("Eliding channel {}/{}: head {} is deprecated", pkg, channel.name(),
                        channel.currentCsvName());
                continue;
            }
            Savepoint savepoint = conn.setSavepoint();
            try {
                writeChannel(conn, pkg, channel.name(), channel.currentCsvName());
                conn.releaseSavepoint(savepoint);
                written.add(channel.name());
            } catch (GraphStructureException e) {
                conn.rollback(savepoint);
                LOG.debug("Discarded channel {}/{}: {}", pkg, channel.name(), e.getMessage());
                errors.add(e);
            }
        }

        setDefaultChannel(conn, pkg, manifest.effectiveDefaultChannel(), written, errors);
        return errors;
    }

    /**
     * Records the default only when it names a channel that was written. A
     * default channel discarded for a broken chain is already reported by
     * its own error.
     */
    private void setDefaultChannel(Connection conn, String pkg, String defaultChannel, Set<String> written,
            List<CatalogException> errors) throws SQLException {
        if (written.contains(defaultChannel)) {
            update(conn, "update-default-channel", defaultChannel, pkg);
            return;
        }
        for (CatalogException error : errors) {
            if (error instanceof GraphStructureException
                    && defaultChannel.equals(((GraphStructureException) error).getChannelName())) {
                return;
            }
        }
        errors.add(new CatalogException("no default channel specified for " + pkg));
    }

    @Override
    public void addPackageGraph(PackageGraph graph) throws CatalogException {
        inTransaction("add package graph " + graph.name(), conn -> {
            String pkg = graph.name();
            List<CatalogException> errors = new ArrayList<>();

            deletePackageRows(conn, pkg);
            update(conn, "insert-package", pkg);

            Set<String> written = new HashSet<>();
            Map<String, ChannelGraph> channels = new TreeMap<>(graph.channels());
            for (Map.Entry<String, ChannelGraph> channel : channels.entrySet()) {
                String head = channel.getValue().head().csvName();
                if (isDeprecated(conn, head)) {
                    LOG.debug("Eliding channel {}/{}: head {} is deprecated", pkg, channel.getKey(), head);
                    continue;
                }
                Savepoint savepoint = conn.setSavepoint();
                try {
                    Set<String> visited = writeChannel(conn, pkg, channel.getKey(), head);
                    for (BundleKey node : realNodes(conn, channel.getValue())) {
                        if (!visited.contains(node.csvName())) {
                            throw new GraphStructureException(GraphStructureException.Kind.INVALID_GRAPH, pkg,
                                    channel.getKey(), "some (non-bottom) nodes defined in the graph were not "
                                            + "mentioned as replacements of any other bundle");
                        }
                    }
                    conn.releaseSavepoint(savepoint);
                    written.add(channel.getKey());
                } catch (GraphStructureException e) {
                    conn.rollback(savepoint);
                    errors.add(e);
                }
            }
            setDefaultChannel(conn, pkg, graph.defaultChannel(), written, errors);
            return errors;
        });
    }

    private Set<BundleKey> realNodes(Connection conn, ChannelGraph graph) throws SQLException {
        Set<BundleKey> all = new LinkedHashSet<>();
        for (Map.Entry<BundleKey, Set<BundleKey>> node : graph.nodes().entrySet()) {
            all.add(node.getKey());
            all.addAll(node.getValue());
        }
        Set<BundleKey> real = new LinkedHashSet<>();
        for (BundleKey key : all) {
            if (exists(conn, "select-bundle-exists", key.csvName())) {
                real.add(key);
            }
        }
        return real;
    }

    /**
     * Inserts the channel and walks its replaces chain from {@code head}.
     *
     * @return every bundle name that received an entry
     */
    private Set<String> writeChannel(Connection conn, String pkg, String channel, String head)
            throws SQLException, GraphStructureException {
        update(conn, "insert-channel", channel, pkg, head);

        Chain chain = selectChain(conn, head);
        if (chain == null) {
            throw new GraphStructureException(GraphStructureException.Kind.DANGLING_REPLACES, pkg, channel,
                    String.format("channel %s head %s does not exist", channel, head));
        }

        Set<String> seen = new HashSet<>();
        Set<String> visited = new LinkedHashSet<>();
        seen.add(head);
        visited.add(head);
        String current = head;
        long entryId = insertEntry(conn, channel, pkg, head, 0);
        int depth = 0;

        while (true) {
            insertFact(conn, "insert-property", Property.TYPE_PACKAGE,
                    Property.packageOf(pkg, chain.version()).value(), current, chain.version(), chain.bundlePath());

            if (isDeprecated(conn, current)) {
                break;
            }

            for (int k = 0; k < chain.skips().size(); k++) {
                String skip = chain.skips().get(k);
                long skipEntry = insertEntry(conn, channel, pkg, skip, depth + 1 + k);
                long synthetic = insertEntry(conn, channel, pkg, current, depth + 1 + k);
                update(conn, "update-entry-replaces", skipEntry, synthetic);
                visited.add(skip);
            }

            String next = chain.replaces();
            if (next.isEmpty()) {
                break;
            }
            if (seen.contains(next)) {
                throw new GraphStructureException(GraphStructureException.Kind.CYCLE, pkg, channel,
                        String.format("cycle detected: %s replaces %s", current, next));
            }

            Chain nextChain = selectChain(conn, next);
            if (nextChain == null) {
                if (isDeprecated(conn, next)) {
                    break;
                }
                throw new GraphStructureException(GraphStructureException.Kind.DANGLING_REPLACES, pkg, channel,
                        String.format("invalid bundle %s, replaces nonexistent bundle %s", current, next));
            }

            long nextEntry = insertEntry(conn, channel, pkg, next, depth + 1);
            update(conn, "update-entry-replaces", nextEntry, entryId);

            seen.add(next);
            visited.add(next);
            current = next;
            chain = nextChain;
            entryId = nextEntry;
            depth++;
        }
        return visited;
    }

    private long insertEntry(Connection conn, String channel, String pkg, String bundle, int depth)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-channel-entry"),
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, channel);
            ps.setString(2, pkg);
            ps.setString(3, bundle);
            ps.setInt(4, depth);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No entry id generated for " + bundle);
                }
                return keys.getLong(1);
            }
        }
    }

    private Chain selectChain(Connection conn, String name) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-bundle-chain"))) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return new Chain(orEmpty(rs.getString("replaces")),
                        SKIP_SPLITTER.splitToList(orEmpty(rs.getString("skips"))),
                        orEmpty(rs.getString("version")), orEmpty(rs.getString("bundlepath")));
            }
        }
    }

    private void deletePackageRows(Connection conn, String pkg) throws SQLException {
        update(conn, "delete-package-entries", pkg);
        update(conn, "delete-package-channels", pkg);
        update(conn, "delete-package", pkg);
    }

    // =====================================================================
    // Deprecation
    // =====================================================================

    @Override
    public void deprecateBundle(String bundlePath) throws CatalogException {
        inTransaction("deprecate " + bundlePath, conn -> {
            String[] bundle = selectBundleForImage(conn, bundlePath);
            if (bundle == null) {
                throw new BundleImageNotFoundException(bundlePath);
            }
            String name = bundle[0];
            String version = bundle[1];

            List<String[]> headChannels = selectPairs(conn, "select-bundle-channels", name);
            checkNotDefaultHead(conn, name);

            Set<String> tail = tailOf(conn, name);
            for (String member : tail) {
                for (String[] channel : headChannels) {
                    for (long entryId : selectIds(conn, member, channel[0], channel[1])) {
                        update(conn, "null-replaces-to-entry", entryId);
                        update(conn, "delete-entry", entryId);
                    }
                }
                if (!selectPairs(conn, "select-bundle-channels", member).isEmpty()) {
                    LOG.debug("Keeping {}: still a member of channels outside the deprecated ones", member);
                    continue;
                }
                if (replacedOnlyFromInside(conn, member, tail, name)) {
                    deleteBundleRows(conn, member);
                    LOG.debug("Removed deprecated tail member {}", member);
                } else {
                    LOG.debug("Keeping {}: replaced by a bundle outside the deprecated tail", member);
                }
            }

            for (String[] channel : selectPairs(conn, "select-channels-headed-by", name)) {
                List<String> members = selectNames(conn, "select-channel-bundle-names", channel[0], channel[1]);
                members.remove(name);
                if (members.isEmpty()) {
                    update(conn, "delete-channel-entries", channel[0], channel[1]);
                    update(conn, "delete-channel", channel[0], channel[1]);
                    LOG.debug("Dropped channel {}/{} headed by deprecated {}", channel[1], channel[0], name);
                }
            }

            Property deprecated = Property.deprecated();
            insertFact(conn, "insert-property", deprecated.type(), deprecated.value(), name, version, bundlePath);
            update(conn, "upsert-deprecated", name);
            return List.of();
        });
        LOG.debug("Deprecated bundle {}", bundlePath);
    }

    private void checkNotDefaultHead(Connection conn, String name) throws SQLException, CatalogException {
        List<String> packages = selectNames(conn, "select-default-channel-head", name);
        if (!packages.isEmpty()) {
            throw new DeprecationPolicyException(String.format("cannot deprecate %s: it heads the default channel "
                    + "of package %s; deprecate all channel heads of the package together to remove it",
                    name, packages.get(0)));
        }
    }

    /** Every bundle reachable from {@code name} over replaces and skips, excluding itself. */
    private Set<String> tailOf(Connection conn, String name) throws SQLException {
        Set<String> tail = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(name);
        while (!queue.isEmpty()) {
            Chain chain = selectChain(conn, queue.poll());
            if (chain == null) {
                continue;
            }
            List<String> predecessors = new ArrayList<>();
            if (!chain.replaces().isEmpty()) {
                predecessors.add(chain.replaces());
            }
            predecessors.addAll(chain.skips());
            for (String predecessor : predecessors) {
                if (!predecessor.equals(name) && tail.add(predecessor)) {
                    queue.add(predecessor);
                }
            }
        }
        return tail;
    }

    private boolean replacedOnlyFromInside(Connection conn, String member, Set<String> tail, String name)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-bundle-replacers"))) {
            ps.setString(1, member);
            ps.setString(2, member);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String replacer = rs.getString("name");
                    boolean replaces = member.equals(rs.getString("replaces"));
                    boolean skips = SKIP_SPLITTER.splitToList(orEmpty(rs.getString("skips"))).contains(member);
                    if ((replaces || skips) && !replacer.equals(name) && !tail.contains(replacer)) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    private String[] selectBundleForImage(Connection conn, String bundlePath) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-bundle-for-image"))) {
            ps.setString(1, bundlePath);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? new String[]{rs.getString("name"), orEmpty(rs.getString("version"))} : null;
            }
        }
    }

    private List<Long> selectIds(Connection conn, String bundle, String pkg, String channel) throws SQLException {
        List<Long> ids = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-entry-ids-in-channel"))) {
            ps.setString(1, bundle);
            ps.setString(2, pkg);
            ps.setString(3, channel);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getLong(1));
                }
            }
        }
        return ids;
    }

    // =====================================================================
    // Removal
    // =====================================================================

    @Override
    public void removePackage(String packageName) throws CatalogException {
        inTransaction("remove package " + packageName, conn -> {
            if (!exists(conn, "select-package-exists", packageName)) {
                throw new NotFoundException("package " + packageName + " not found");
            }
            for (String bundle : selectNames(conn, "select-package-bundle-names", packageName)) {
                deleteBundleRows(conn, bundle);
            }
            deletePackageRows(conn, packageName);
            return List.of();
        });
        LOG.info("Removed package {}", packageName);
        removeStrandedBundles();
    }

    @Override
    public int removeStrandedBundles() throws CatalogException {
        int[] removed = new int[1];
        inTransaction("remove stranded bundles", conn -> {
            List<String> stranded = selectNames(conn, "select-stranded-bundles");
            for (String bundle : stranded) {
                deleteBundleRows(conn, bundle);
            }
            removed[0] = stranded.size();
            return List.of();
        });
        if (removed[0] > 0) {
            LOG.info("Removed {} stranded bundle(s)", removed[0]);
        }
        return removed[0];
    }

    @Override
    public void clearNonHeadBundles() throws CatalogException {
        inTransaction("clear non-head bundles", conn -> {
            update(conn, "clear-non-head-bundles");
            return List.of();
        });
    }

    private void deleteBundleRows(Connection conn, String name) throws SQLException {
        update(conn, "delete-bundle-providers", name);
        update(conn, "delete-bundle-requirers", name);
        update(conn, "delete-bundle-entries", name);
        update(conn, "delete-bundle-properties", name);
        update(conn, "delete-bundle-dependencies", name);
        update(conn, "delete-bundle-images", name);
        update(conn, "delete-bundle", name);
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    @FunctionalInterface
    private interface Work {
        List<CatalogException> run(Connection conn) throws SQLException, CatalogException;
    }

    /**
     * Runs {@code work} in one transaction. Errors returned by the work are
     * thrown after the commit; errors thrown by it roll everything back.
     */
    private void inTransaction(String action, Work work) throws CatalogException {
        List<CatalogException> errors;
        try (Connection conn = db.getConnection()) {
            conn.setAutoCommit(false);
            try {
                errors = work.run(conn);
                conn.commit();
            } catch (SQLException | CatalogException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to " + action, e);
        }
        CatalogErrors.throwIfAny(errors);
    }

    private boolean isDeprecated(Connection conn, String name) throws SQLException {
        return exists(conn, "select-deprecated", name);
    }

    private boolean exists(Connection conn, String sql, String param) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sql))) {
            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private int update(Connection conn, String sql, Object... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sql))) {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            return ps.executeUpdate();
        }
    }

    private List<String> selectNames(Connection conn, String sql, String... params) throws SQLException {
        List<String> names = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sql))) {
            for (int i = 0; i < params.length; i++) {
                ps.setString(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    names.add(rs.getString(1));
                }
            }
        }
        return names;
    }

    private List<String[]> selectPairs(Connection conn, String sql, String param) throws SQLException {
        List<String[]> pairs = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sql))) {
            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    pairs.add(new String[]{rs.getString(1), rs.getString(2)});
                }
            }
        }
        return pairs;
    }

    private static String encodeObjects(List<String> objects) {
        if (objects.isEmpty()) {
            return null;
        }
        ArrayNode array = MAPPER.createArrayNode();
        try {
            for (String object : objects) {
                array.add(MAPPER.readTree(object));
            }
            return MAPPER.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Bundle object is not valid JSON", e);
        }
    }

    private static String nullIfEmpty(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }

    private record Chain(String replaces, List<String> skips, String version, String bundlePath) {
    }
}
