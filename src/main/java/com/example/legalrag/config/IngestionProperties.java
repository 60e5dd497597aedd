package com.example.legalrag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Data
@Component
@ConfigurationProperties(prefix = "ingestion")
public class IngestionProperties {
    private String userAgent = "legal-rag-seeder/0.1";
    private String preferredLanguage = "ro";
    private String fallbackLanguage = "en";
    /** Placeholders: {lang} (upper-cased) and {id}. */
    private String documentUrlTemplate = "https://eur-lex.europa.eu/legal-content/{lang}/TXT/?uri=CELEX:{id}";
    private Http http = new Http();
    private Sparql sparql = new Sparql();
    private Fetch fetch = new Fetch();
    private Prune prune = new Prune();

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration socketTimeout = Duration.ofSeconds(90);
    }

    @Data
    public static class Sparql {
        private List<String> endpoints = new ArrayList<>(List.of(
            "https://op.europa.eu/webapi/rdf/sparql",
            "https://publications.europa.eu/webapi/rdf/sparql"));
        private Duration timeout = Duration.ofSeconds(60);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(700);
        private Duration maxBackoff = Duration.ofSeconds(10);
    }

    @Data
    public static class Fetch {
        private Duration timeout = Duration.ofSeconds(25);
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(800);
        private Duration maxBackoff = Duration.ofSeconds(30);
    }

    @Data
    public static class Prune {
        private String language = "en";
    }

    public String documentUrl(String documentId, String language) {
        return documentUrlTemplate
            .replace("{lang}", language.toUpperCase(Locale.ROOT))
            .replace("{id}", documentId);
    }
}
