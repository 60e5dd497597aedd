package com.example.legalrag.exception;

public class DiscoveryException extends RuntimeException {

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
