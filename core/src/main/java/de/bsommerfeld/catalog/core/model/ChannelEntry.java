package de.bsommerfeld.catalog.core.model;

/**
 * One replacement edge in a channel: {@code bundleName} replaces
 * {@code replaces} (empty for the tail of a chain).
 */
public record ChannelEntry(String packageName, String channelName, String bundleName, String replaces) {

    public ChannelEntry {
        replaces = replaces == null ? "" : replaces;
    }
}
