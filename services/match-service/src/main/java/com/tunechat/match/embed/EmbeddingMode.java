package com.tunechat.match.embed;

public enum EmbeddingMode {
    HTTP,
    TOY
}
