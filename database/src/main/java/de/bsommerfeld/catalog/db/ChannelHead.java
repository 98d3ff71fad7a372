package de.bsommerfeld.catalog.db;

/**
 * The head of one channel, flagged when that channel is its package's
 * default.
 */
public record ChannelHead(String packageName, String channelName, String bundleName, String bundlePath,
        boolean defaultChannel) {
}
