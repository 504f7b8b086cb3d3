package com.tunechat.match.moderation;

/**
 * Per-request moderation settings passed to the client.
 */
public record ModerationConfig(boolean strictMode, boolean allowNsfw) {
}
