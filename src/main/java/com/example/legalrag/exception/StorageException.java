package com.example.legalrag.exception;

import lombok.Getter;

@Getter
public class StorageException extends RuntimeException {

    private final String documentId;

    public StorageException(String documentId, Throwable cause) {
        super("Storing passages failed for " + documentId + ", transaction rolled back", cause);
        this.documentId = documentId;
    }
}
