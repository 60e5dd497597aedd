package com.example.legalrag.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record AskRequest(
    @Size(min = 1) String question,
    @Size(min = 1) String query,
    @Positive @Max(50) Integer k
) {
    /** Either field carries the question; {@code question} wins when both are set. */
    public String text() {
        return question != null ? question : query;
    }
}
