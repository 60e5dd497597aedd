package com.example.legalrag.repository;

import com.example.legalrag.dto.DiscoveryRecord;
import com.example.legalrag.dto.Passage;
import com.example.legalrag.dto.RetrievedPassage;
import com.example.legalrag.util.VectorScores;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Map-backed store for tests; scores with the same cosine formula as pgvector. */
public class InMemoryPassageStore implements PassageStore {

    private record Row(Passage passage, float[] vector) {}

    private final Map<String, List<Row>> rows = new TreeMap<>();
    private final Map<String, DiscoveryRecord> documents = new TreeMap<>();

    @Override
    public void replaceDocument(DiscoveryRecord document, List<Passage> passages, List<float[]> vectors) {
        if (passages.size() != vectors.size()) throw new IllegalArgumentException("size mismatch");
        List<Row> replaced = new ArrayList<>();
        for (int i = 0; i < passages.size(); i++) {
            replaced.add(new Row(passages.get(i), vectors.get(i)));
        }
        documents.put(document.id(), document);
        rows.put(document.id(), replaced);
    }

    @Override
    public List<RetrievedPassage> query(float[] vector, int k) {
        return rows.values().stream()
            .flatMap(List::stream)
            .map(r -> new RetrievedPassage(r.passage().documentId(), r.passage().index(), r.passage().text(),
                VectorScores.similarityFromDistance(cosineDistance(vector, r.vector()))))
            .sorted(Comparator.comparingDouble(RetrievedPassage::score).reversed())
            .limit(Math.max(1, k))
            .toList();
    }

    @Override
    public List<String> listDocumentIds() {
        return List.copyOf(rows.keySet());
    }

    @Override
    public int deleteDocument(String documentId) {
        documents.remove(documentId);
        List<Row> removed = rows.remove(documentId);
        return removed == null ? 0 : removed.size();
    }

    public List<Passage> findPassages(String documentId) {
        return rows.getOrDefault(documentId, List.of()).stream().map(Row::passage).toList();
    }

    public List<float[]> vectors(String documentId) {
        return rows.getOrDefault(documentId, List.of()).stream().map(Row::vector).toList();
    }

    public DiscoveryRecord document(String documentId) {
        return documents.get(documentId);
    }

    static double cosineDistance(float[] a, float[] b) {
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na += (double) a[i] * a[i];
            nb += (double) b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 1;
        return 1 - dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}
