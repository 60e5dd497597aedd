package com.example.legalrag.dto;

import java.util.List;

public record PruneSummary(int checked, List<ValidityStatus> flagged, int removed, boolean dryRun) {}
