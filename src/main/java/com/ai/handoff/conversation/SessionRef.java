package com.ai.handoff.conversation;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * A conversation session: one canonical identity on one channel.
 * The channel is canonicalized on construction.
 */
public record SessionRef(String identity, String channel) {

    public static final String DEFAULT_CHANNEL = "default";

    public SessionRef {
        if (StringUtils.isBlank(identity)) {
            throw new IllegalArgumentException("identity must not be blank");
        }
        channel = canonicalChannel(channel);
    }

    public static SessionRef of(String identity, String channel) {
        return new SessionRef(identity, channel);
    }

    public static String canonicalChannel(String channel) {
        if (StringUtils.isBlank(channel)) {
            return DEFAULT_CHANNEL;
        }
        return channel.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s:]+", "_");
    }

    @Override
    public String toString() {
        return identity + ":" + channel;
    }
}
