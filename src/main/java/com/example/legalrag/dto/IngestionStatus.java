package com.example.legalrag.dto;

public enum IngestionStatus {
    INGESTED,
    /** Parsed and chunked, embedding and storage skipped. */
    DRY_RUN,
    SKIPPED_NO_LONGER_VALID
}
