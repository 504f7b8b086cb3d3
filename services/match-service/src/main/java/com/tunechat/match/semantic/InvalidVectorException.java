package com.tunechat.match.semantic;

public class InvalidVectorException extends RuntimeException {
    public InvalidVectorException(String message) {
        super(message);
    }

    public InvalidVectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
