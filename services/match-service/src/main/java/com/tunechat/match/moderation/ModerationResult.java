package com.tunechat.match.moderation;

public record ModerationResult(
    boolean allowed,
    ModerationCategory category,
    double confidence,
    String reason,
    String replacementText
) {
    public ModerationResult {
        category = category == null ? ModerationCategory.CLEAN : category;
    }

    public static ModerationResult clean() {
        return new ModerationResult(true, ModerationCategory.CLEAN, 1.0, null, null);
    }

    public boolean hasReplacement() {
        return replacementText != null && !replacementText.isBlank();
    }
}
