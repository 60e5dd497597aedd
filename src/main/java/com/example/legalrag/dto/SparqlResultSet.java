package com.example.legalrag.dto;

import java.util.List;
import java.util.Map;

/** Rows of a SPARQL SELECT, each mapping variable name to its lexical value. */
public record SparqlResultSet(List<Map<String, String>> rows) {

    public static SparqlResultSet empty() {
        return new SparqlResultSet(List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
