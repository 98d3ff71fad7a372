package de.bsommerfeld.catalog.core.model;

import java.util.List;

/**
 * Channel layout of a package: which bundle heads which channel, and which
 * channel is the default. Also the result shape of package lookups.
 */
public record PackageManifest(String packageName, List<PackageChannel> channels, String defaultChannelName) {

    public PackageManifest {
        channels = channels == null ? List.of() : List.copyOf(channels);
        defaultChannelName = defaultChannelName == null ? "" : defaultChannelName;
    }

    /**
     * The declared default channel, or the only channel when none is
     * declared and there is exactly one. Empty otherwise.
     */
    public String effectiveDefaultChannel() {
        if (!defaultChannelName.isEmpty()) {
            return defaultChannelName;
        }
        if (channels.size() == 1) {
            return channels.get(0).name();
        }
        return "";
    }
}
