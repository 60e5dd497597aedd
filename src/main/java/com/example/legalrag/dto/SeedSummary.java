package com.example.legalrag.dto;

import java.util.List;

public record SeedSummary(
    int documents,
    List<DocumentIngestionReport> reports,
    List<String> failedDocumentIds,
    int totalPassages,
    int averagePassageLength,
    long discoveryMs,
    long totalMs,
    boolean aborted,
    String abortReason
) {}
