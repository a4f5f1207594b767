package org.islandora.handle;

/**
 * Where the caller should surface a {@link Message}.
 */
public enum MessageChannel {
    USER_NOTICE("user-notice"), OPERATIONAL_LOG("operational-log");

    final String channelName;

    MessageChannel(String name) {
        channelName = name;
    }

    public String getName() {
        return channelName;
    }
}
