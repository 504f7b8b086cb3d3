package com.tunechat.match.catalog;

public enum VectorSpace {
    /** Embedding of title, artist, tags and descriptor phrases. */
    META,
    /** Embedding of the generated themes/mood/setting summary. */
    ABOUTNESS
}
