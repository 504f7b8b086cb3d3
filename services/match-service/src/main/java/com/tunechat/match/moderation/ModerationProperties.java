package com.tunechat.match.moderation;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "match.moderation")
public class ModerationProperties {
    private ModerationMode mode = ModerationMode.NONE;
    private String baseUrl;
    private int timeoutMs = 500;
    private boolean strictMode = false;
    private boolean allowNsfw = false;
    private boolean failOpen = true;

    public ModerationMode getMode() {
        return mode;
    }

    public void setMode(ModerationMode mode) {
        this.mode = mode;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    public void setStrictMode(boolean strictMode) {
        this.strictMode = strictMode;
    }

    public boolean isAllowNsfw() {
        return allowNsfw;
    }

    public void setAllowNsfw(boolean allowNsfw) {
        this.allowNsfw = allowNsfw;
    }

    public boolean isFailOpen() {
        return failOpen;
    }

    public void setFailOpen(boolean failOpen) {
        this.failOpen = failOpen;
    }
}
