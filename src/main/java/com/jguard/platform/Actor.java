package com.jguard.platform;

/**
 * The user who triggered an event, as seen by the filtering core.
 */
public record Actor(
        String id,
        String name,
        String mention,
        String avatarUrl,
        boolean bot
) {
    public Actor(String id, String name) {
        this(id, name, "<@" + id + ">", null, false);
    }
}
