package com.example.legalrag.dto;

public enum TokenKind {
    HEADING,
    BODY
}
