package com.tunechat.match.moderation;

public record ModerationAnnotation(ModerationCategory category, boolean wasFiltered, String originalText) {
    public static ModerationAnnotation clean(String text) {
        return new ModerationAnnotation(ModerationCategory.CLEAN, false, text);
    }
}
