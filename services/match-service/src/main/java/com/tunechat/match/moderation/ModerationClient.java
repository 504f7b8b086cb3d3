package com.tunechat.match.moderation;

public interface ModerationClient {
    /**
     * Throws {@link ModerationUnavailableException} when no verdict could be obtained.
     */
    ModerationResult moderate(String text, ModerationConfig config);
}
