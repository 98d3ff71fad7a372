package de.bsommerfeld.catalog.core.model;

import java.util.Objects;

/**
 * Identifies a Kubernetes API type. {@code plural} is informational and
 * ignored by {@link #sameType}.
 */
public record GroupVersionKind(String group, String version, String kind, String plural) {

    public GroupVersionKind {
        group = group == null ? "" : group;
        version = version == null ? "" : version;
        kind = kind == null ? "" : kind;
        plural = plural == null ? "" : plural;
    }

    public GroupVersionKind(String group, String version, String kind) {
        this(group, version, kind, "");
    }

    public boolean sameType(GroupVersionKind other) {
        return other != null
                && Objects.equals(group, other.group)
                && Objects.equals(version, other.version)
                && Objects.equals(kind, other.kind);
    }

    @Override
    public String toString() {
        return group + "/" + version + "/" + kind;
    }
}
