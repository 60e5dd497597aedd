package com.example.legalrag.dto;

public record DocumentIngestionReport(
    String documentId,
    IngestionStatus status,
    int passageCount,
    int averagePassageLength,
    long fetchMs,
    long parseMs,
    long dbMs,
    String endOfValidity
) {
    public long totalMs() {
        return fetchMs + parseMs + dbMs;
    }

    public static DocumentIngestionReport noLongerValid(String documentId, long fetchMs, String endOfValidity) {
        return new DocumentIngestionReport(documentId, IngestionStatus.SKIPPED_NO_LONGER_VALID,
            0, 0, fetchMs, 0, 0, endOfValidity);
    }
}
