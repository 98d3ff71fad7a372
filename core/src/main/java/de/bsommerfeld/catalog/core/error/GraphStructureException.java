package de.bsommerfeld.catalog.core.error;

/**
 * A channel's replacement graph is malformed. Always fatal for the affected
 * channel; never repaired silently.
 */
public class GraphStructureException extends CatalogException {

    public enum Kind {
        /** No bundle lacks an incoming replacement edge. */
        NO_HEAD,
        /** More than one bundle lacks an incoming replacement edge. */
        MULTIPLE_HEADS,
        /** Walking {@code replaces} revisits a bundle. */
        CYCLE,
        /** A {@code replaces} target does not exist. */
        DANGLING_REPLACES,
        /** Real nodes are unreachable from the head. */
        INVALID_GRAPH
    }

    private final Kind kind;
    private final String packageName;
    private final String channelName;

    public GraphStructureException(Kind kind, String packageName, String channelName, String message) {
        super(message);
        this.kind = kind;
        this.packageName = packageName;
        this.channelName = channelName;
    }

    public Kind getKind() {
        return kind;
    }

    public String getPackageName() {
        return packageName;
    }

    public String getChannelName() {
        return channelName;
    }
}
