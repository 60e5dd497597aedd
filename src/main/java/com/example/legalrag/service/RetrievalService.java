package com.example.legalrag.service;

import com.example.legalrag.config.RagProperties;
import com.example.legalrag.dto.RetrievedPassage;
import com.example.legalrag.repository.PassageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalService {

    private final PassageEmbeddingService embeddingService;
    private final PassageStore store;
    private final RagProperties ragProperties;

    /**
     * Embeds the query and returns the nearest passages, best first.
     *
     * @param query natural-language question
     * @param k     number of passages, {@code null} for the configured default
     */
    public List<RetrievedPassage> retrieve(String query, Integer k) {
        int topK = k != null ? k : ragProperties.getSearch().getDefaultK();
        float[] vector = embeddingService.embed(query);
        List<RetrievedPassage> hits = store.query(vector, topK);
        log.debug("Retrieved {} passages for k={}", hits.size(), topK);
        return hits;
    }
}
