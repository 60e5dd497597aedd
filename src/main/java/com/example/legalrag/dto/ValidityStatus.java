package com.example.legalrag.dto;

/**
 * Result of scanning an act's page for "no longer in force" markers.
 *
 * @param documentId    act that was scanned
 * @param noLongerValid whether any marker matched
 * @param endOfValidity "dd/mm/yyyy" when the page states it, otherwise {@code null}
 */
public record ValidityStatus(String documentId, boolean noLongerValid, String endOfValidity) {}
