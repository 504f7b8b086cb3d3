package com.tunechat.match.catalog;

public record VectorNeighbor(String songId, double distance) {
    public double similarity() {
        return 1.0 - distance;
    }
}
