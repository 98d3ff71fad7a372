package de.bsommerfeld.catalog.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.TreeMap;

/**
 * Typed fact attached to a bundle. The value is a JSON document; values
 * produced by the factories below serialize object keys in sorted order so
 * that equal facts compare equal as strings.
 */
public record Property(String type, String value) {

    public static final String TYPE_PACKAGE = "olm.package";
    public static final String TYPE_GVK = "olm.gvk";
    public static final String TYPE_GVK_REQUIRED = "olm.gvk.required";
    public static final String TYPE_PACKAGE_REQUIRED = "olm.package.required";
    public static final String TYPE_DEPRECATED = "olm.deprecated";
    public static final String TYPE_BUNDLE_OBJECT = "olm.bundle.object";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public Property {
        type = type == null ? "" : type;
        value = value == null ? "" : value;
    }

    public static Property gvk(GroupVersionKind gvk) {
        return new Property(TYPE_GVK, gvkValue(gvk));
    }

    public static Property gvkRequired(GroupVersionKind gvk) {
        return new Property(TYPE_GVK_REQUIRED, gvkValue(gvk));
    }

    public static Property packageOf(String packageName, String version) {
        Map<String, String> value = new TreeMap<>();
        value.put("packageName", packageName);
        value.put("version", version);
        return new Property(TYPE_PACKAGE, write(value));
    }

    public static Property deprecated() {
        return new Property(TYPE_DEPRECATED, "{}");
    }

    /**
     * Canonical JSON form of a GVK as stored in {@code olm.gvk} properties:
     * {@code {"group":..,"kind":..,"version":..}}.
     */
    public static String gvkValue(GroupVersionKind gvk) {
        Map<String, String> value = new TreeMap<>();
        value.put("group", gvk.group());
        value.put("kind", gvk.kind());
        value.put("version", gvk.version());
        return write(value);
    }

    /** Parses a {@code olm.gvk} or {@code olm.gvk.required} value. */
    public static GroupVersionKind parseGvk(String value) {
        JsonNode node = read(value);
        return new GroupVersionKind(node.path("group").asText(""), node.path("version").asText(""),
                node.path("kind").asText(""));
    }

    public JsonNode json() {
        return read(value);
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode property value", e);
        }
    }

    private static JsonNode read(String value) {
        try {
            return MAPPER.readTree(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Property value is not valid JSON: " + value, e);
        }
    }
}
