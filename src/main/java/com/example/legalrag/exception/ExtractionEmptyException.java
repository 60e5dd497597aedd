package com.example.legalrag.exception;

import lombok.Getter;

@Getter
public class ExtractionEmptyException extends RuntimeException {

    private final String documentId;

    public ExtractionEmptyException(String documentId) {
        super("No usable content extracted for " + documentId);
        this.documentId = documentId;
    }
}
