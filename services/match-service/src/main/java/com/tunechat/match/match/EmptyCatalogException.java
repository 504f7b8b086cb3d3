package com.tunechat.match.match;

public class EmptyCatalogException extends RuntimeException {
    public EmptyCatalogException(String message) {
        super(message);
    }
}
