package com.example.legalrag.dto;

public record Passage(String documentId, int index, String text) {}
