package com.delta.siteaudit.generation.client;

public class GenerationCallException extends RuntimeException {
    private final int statusCode;

    public GenerationCallException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public GenerationCallException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
