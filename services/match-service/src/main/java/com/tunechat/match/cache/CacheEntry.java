package com.tunechat.match.cache;

record CacheEntry<V>(V value, long expiresAtMs) {
    boolean isExpired(long nowMs) {
        return nowMs > expiresAtMs;
    }
}
