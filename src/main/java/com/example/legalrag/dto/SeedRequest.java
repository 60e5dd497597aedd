package com.example.legalrag.dto;

import java.util.List;

/**
 * Parameters of one seeding batch. A non-empty {@code documentIds} list bypasses discovery.
 */
public record SeedRequest(
    int pageSize,
    int pageCount,
    Integer sinceYear,
    List<String> documentIds,
    boolean dryRun
) {
    public SeedRequest {
        pageSize = Math.max(1, pageSize);
        pageCount = Math.max(1, pageCount);
        documentIds = documentIds == null ? List.of() : List.copyOf(documentIds);
    }

    public boolean hasManualIds() {
        return !documentIds.isEmpty();
    }
}
