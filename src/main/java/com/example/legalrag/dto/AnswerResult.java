package com.example.legalrag.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record AnswerResult(String text, List<Citation> citations) {

    public static AnswerResult abstention(String text) {
        return new AnswerResult(text, List.of());
    }

    @JsonIgnore
    public boolean isAbstention() {
        return citations.isEmpty();
    }
}
