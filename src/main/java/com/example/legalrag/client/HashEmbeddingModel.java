package com.example.legalrag.client;

import org.springframework.ai.document.Document;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic stand-in for a remote embedding model. Seeds a linear congruential generator with the FNV-1a hash
 * of the text, so equal texts always map to equal vectors. Carries no semantic signal; meant for offline seeding
 * and tests.
 */
public class HashEmbeddingModel implements EmbeddingModel {

    private static final int FNV_OFFSET = 0x811C9DC5;
    private static final int FNV_PRIME = 16777619;
    private static final long LCG_MULTIPLIER = 1103515245L;
    private static final long LCG_INCREMENT = 12345L;
    private static final long MASK = 0x7fffffffL;

    private final int dimensions;

    public HashEmbeddingModel(int dimensions) {
        if (dimensions <= 0) throw new IllegalArgumentException("dimensions must be positive");
        this.dimensions = dimensions;
    }

    @Override
    public EmbeddingResponse call(EmbeddingRequest request) {
        List<String> texts = request.getInstructions();
        List<Embedding> embeddings = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            embeddings.add(new Embedding(vectorFor(texts.get(i)), i));
        }
        return new EmbeddingResponse(embeddings);
    }

    @Override
    public float[] embed(String text) {
        return vectorFor(text);
    }

    @Override
    public float[] embed(Document document) {
        return vectorFor(document.getText());
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        return texts.stream().map(this::vectorFor).toList();
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    float[] vectorFor(String text) {
        int h = FNV_OFFSET;
        for (int i = 0; i < text.length(); i++) {
            h ^= text.charAt(i);
            h *= FNV_PRIME;
        }
        long x = Integer.toUnsignedLong(h);
        if (x == 0) x = 123456789L;

        float[] v = new float[dimensions];
        for (int i = 0; i < dimensions; i++) {
            x = (LCG_MULTIPLIER * x + LCG_INCREMENT) & MASK;
            v[i] = (float) (((double) x / MASK) * 2 - 1);
        }
        return v;
    }
}
