package com.example.legalrag.dto;

public record Citation(String tag, double score) {}
