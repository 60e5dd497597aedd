package com.example.legalrag.dto;

import java.time.LocalDate;

/**
 * One candidate act found by metadata discovery.
 *
 * @param id             CELEX number, the stable document identifier
 * @param title          title in {@code language}
 * @param language       two-letter language code of the chosen expression
 * @param issued         issue date, {@code null} when the endpoint did not return one
 * @param sourceLocation URL of the HTML rendition in {@code language}
 * @param work           work URI, may be empty
 * @param expression     expression URI, may be empty
 */
public record DiscoveryRecord(
    String id,
    String title,
    String language,
    LocalDate issued,
    String sourceLocation,
    String work,
    String expression
) {
    public static DiscoveryRecord manual(String id, String language, String sourceLocation) {
        return new DiscoveryRecord(id, id, language, null, sourceLocation, "", "");
    }
}
