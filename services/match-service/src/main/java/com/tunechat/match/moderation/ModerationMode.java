package com.tunechat.match.moderation;

public enum ModerationMode {
    HTTP,
    NONE
}
