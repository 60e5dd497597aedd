package com.example.legalrag.exception;

import lombok.Getter;

@Getter
public class FetchException extends RuntimeException {

    private final String documentId;
    /** Last HTTP status seen, or {@code null} when no response arrived. */
    private final Integer status;

    public FetchException(String documentId, Integer status, String message, Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
        this.status = status;
    }
}
