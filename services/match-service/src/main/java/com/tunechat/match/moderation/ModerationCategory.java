package com.tunechat.match.moderation;

import java.util.Locale;

public enum ModerationCategory {
    HARASSMENT,
    NSFW,
    SLUR,
    SPAM,
    CLEAN;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Unknown or missing labels map to {@link #CLEAN}.
     */
    public static ModerationCategory fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return CLEAN;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return CLEAN;
        }
    }
}
