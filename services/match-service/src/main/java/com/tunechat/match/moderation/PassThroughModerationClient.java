package com.tunechat.match.moderation;

public class PassThroughModerationClient implements ModerationClient {
    @Override
    public ModerationResult moderate(String text, ModerationConfig config) {
        return ModerationResult.clean();
    }
}
