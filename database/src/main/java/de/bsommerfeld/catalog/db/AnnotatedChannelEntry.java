package de.bsommerfeld.catalog.db;

/**
 * A channel entry together with the version and path of its bundle and of
 * the bundle it replaces. Placeholder entries carry empty versions and
 * paths.
 */
public record AnnotatedChannelEntry(String packageName, String channelName, String bundleName, String version,
        String bundlePath, String replaces, String replacesVersion, String replacesBundlePath) {

    public AnnotatedChannelEntry {
        version = version == null ? "" : version;
        bundlePath = bundlePath == null ? "" : bundlePath;
        replaces = replaces == null ? "" : replaces;
        replacesVersion = replacesVersion == null ? "" : replacesVersion;
        replacesBundlePath = replacesBundlePath == null ? "" : replacesBundlePath;
    }
}
