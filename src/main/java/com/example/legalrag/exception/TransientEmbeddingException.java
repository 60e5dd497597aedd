package com.example.legalrag.exception;

public class TransientEmbeddingException extends EmbeddingException {

    public TransientEmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
