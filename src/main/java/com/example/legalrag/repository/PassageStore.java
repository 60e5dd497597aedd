package com.example.legalrag.repository;

import com.example.legalrag.dto.DiscoveryRecord;
import com.example.legalrag.dto.Passage;
import com.example.legalrag.dto.RetrievedPassage;

import java.util.List;

/**
 * Persistent passage index keyed by (documentId, passage index).
 */
public interface PassageStore {

    /**
     * Replaces every stored passage of {@code document} with {@code passages}, atomically. On failure the previous
     * passage set stays untouched.
     *
     * @param passages indices 0..n-1, in order
     * @param vectors  one vector per passage, same order
     */
    void replaceDocument(DiscoveryRecord document, List<Passage> passages, List<float[]> vectors);

    /**
     * Nearest passages by cosine distance, most similar first.
     *
     * @param k clamped to [1, maxK]
     */
    List<RetrievedPassage> query(float[] vector, int k);

    List<String> listDocumentIds();

    int deleteDocument(String documentId);
}
