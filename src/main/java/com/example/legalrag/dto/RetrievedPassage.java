package com.example.legalrag.dto;

public record RetrievedPassage(String documentId, int passageIndex, String text, double score) {}
