package de.bsommerfeld.catalog.core.model;

/**
 * Typed requirement of a bundle, e.g. {@code olm.gvk} or {@code olm.package}.
 * The value is a JSON document.
 */
public record Dependency(String type, String value) {

    public static final String TYPE_GVK = "olm.gvk";
    public static final String TYPE_PACKAGE = "olm.package";

    public Dependency {
        type = type == null ? "" : type;
        value = value == null ? "" : value;
    }

    public static Dependency gvk(GroupVersionKind gvk) {
        return new Dependency(TYPE_GVK, Property.gvkValue(gvk));
    }
}
