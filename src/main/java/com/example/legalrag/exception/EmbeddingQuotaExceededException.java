package com.example.legalrag.exception;

/**
 * The embedding provider refused the call because the account quota is exhausted.
 * Retrying cannot help; an operator has to fix billing or switch to the offline profile.
 */
public class EmbeddingQuotaExceededException extends EmbeddingException {

    public EmbeddingQuotaExceededException(Throwable cause) {
        super("Embedding quota exceeded. Configure billing for the API key or run with --no-embed.", cause);
    }
}
