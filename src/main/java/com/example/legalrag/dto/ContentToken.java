package com.example.legalrag.dto;

public record ContentToken(TokenKind kind, String text) {

    public static ContentToken heading(String text) {
        return new ContentToken(TokenKind.HEADING, text);
    }

    public static ContentToken body(String text) {
        return new ContentToken(TokenKind.BODY, text);
    }

    public boolean isHeading() {
        return kind == TokenKind.HEADING;
    }
}
