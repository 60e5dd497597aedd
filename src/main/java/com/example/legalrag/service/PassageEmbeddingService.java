package com.example.legalrag.service;

import com.example.legalrag.client.HttpRetries;
import com.example.legalrag.config.EmbeddingProperties;
import com.example.legalrag.exception.EmbeddingException;
import com.example.legalrag.exception.EmbeddingQuotaExceededException;
import com.example.legalrag.exception.TransientEmbeddingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.ListUtils;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class PassageEmbeddingService {

    private final EmbeddingModel embeddingModel;
    private final EmbeddingProperties props;

    /**
     * Embeds a single text, typically a user question.
     * @param text text to embed.
     * @return vector with the configured dimension.
     */
    public float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    /**
     * Embeds the texts in partitions of the configured batch size, preserving order.
     * Transient provider failures are retried per partition with exponential backoff.
     *
     * @param texts passage texts, in passage index order.
     * @return one vector per input text.
     * @throws EmbeddingQuotaExceededException when the provider reports an exhausted quota; never retried.
     * @throws TransientEmbeddingException     when retries are exhausted.
     */
    public List<float[]> embedAll(List<String> texts) {
        if (CollectionUtils.isEmpty(texts)) return List.of();
        List<float[]> out = new ArrayList<>(texts.size());
        for (List<String> partition : ListUtils.partition(texts, Math.max(1, props.getBatchSize()))) {
            out.addAll(embedPartition(partition));
        }
        return out;
    }

    private List<float[]> embedPartition(List<String> partition) {
        List<float[]> vectors;
        try {
            vectors = Mono.fromCallable(() -> embeddingModel.embed(partition))
                .retryWhen(Retry.backoff(Math.max(0, props.getMaxAttempts() - 1), props.getInitialBackoff())
                    .maxBackoff(props.getMaxBackoff())
                    .jitter(0.5)
                    .filter(PassageEmbeddingService::isTransient)
                    .doBeforeRetry(s -> log.warn("Embedding call failed, retrying ({}): {}",
                        s.totalRetries() + 1, s.failure().getMessage()))
                    .onRetryExhaustedThrow((spec, signal) ->
                        new TransientEmbeddingException("Embedding retries exhausted", signal.failure())))
                .block();
        } catch (RuntimeException e) {
            throw classify(Exceptions.unwrap(e));
        }

        if (vectors == null || vectors.size() != partition.size()) {
            throw new EmbeddingException("Expected " + partition.size() + " embeddings, got "
                + (vectors == null ? 0 : vectors.size()));
        }
        for (float[] v : vectors) {
            if (v.length != props.getDim()) {
                throw new EmbeddingException("Expected dimension " + props.getDim() + ", got " + v.length);
            }
        }
        return vectors;
    }

    static RuntimeException classify(Throwable t) {
        if (t instanceof EmbeddingException e) return e;
        if (isQuotaExceeded(t)) return new EmbeddingQuotaExceededException(t);
        if (isTransient(t)) return new TransientEmbeddingException(t.getMessage(), t);
        return new EmbeddingException("Embedding failed: " + t.getMessage(), t);
    }

    static boolean isQuotaExceeded(Throwable t) {
        String msg = String.valueOf(t.getMessage()).toLowerCase(Locale.ROOT);
        return msg.contains("quota");
    }

    /** Spring AI reports every 4xx, 429 included, as {@code NonTransientAiException("<status> - <body>")}. */
    static boolean isRateLimited(Throwable t) {
        String msg = String.valueOf(t.getMessage()).toLowerCase(Locale.ROOT);
        return msg.startsWith("429") || msg.contains("rate_limit") || msg.contains("rate limit")
            || msg.contains("too many requests");
    }

    static boolean isTransient(Throwable t) {
        if (isQuotaExceeded(t)) return false;
        return t instanceof TransientAiException
            || (t instanceof NonTransientAiException && isRateLimited(t))
            || t instanceof ResourceAccessException
            || HttpRetries.isTransient(t);
    }
}
