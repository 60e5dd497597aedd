package com.example.legalrag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "rag")
public class RagProperties {
    private Search search = new Search();
    private Answer answer = new Answer();
    private Chunking chunking = new Chunking();

    @Data
    public static class Search {
        private int defaultK = 5;
        private int maxK = 50;
    }

    @Data
    public static class Answer {
        /** Top similarity below this value makes the answerer abstain. */
        private double relevanceThreshold = 0.25;
        private double temperature = 0.2;
        private String language = "ro";
    }

    @Data
    public static class Chunking {
        private int minSize = 800;
        private int maxSize = 1000;
    }
}
