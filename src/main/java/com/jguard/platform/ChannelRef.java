package com.jguard.platform;

/**
 * A channel handle. {@code guildId} is null for direct-message channels.
 */
public record ChannelRef(String id, String name, String guildId) {

    public static ChannelRef direct(String id) {
        return new ChannelRef(id, null, null);
    }

    public boolean inGuild() {
        return guildId != null;
    }

    public String mention() {
        return "<#" + id + ">";
    }
}
