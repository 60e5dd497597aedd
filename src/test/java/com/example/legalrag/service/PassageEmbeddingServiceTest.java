package com.example.legalrag.service;

import com.example.legalrag.config.EmbeddingProperties;
import com.example.legalrag.exception.EmbeddingException;
import com.example.legalrag.exception.EmbeddingQuotaExceededException;
import com.example.legalrag.exception.TransientEmbeddingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PassageEmbeddingServiceTest {

    private final EmbeddingModel model = mock(EmbeddingModel.class);
    private final EmbeddingProperties props = new EmbeddingProperties();
    private PassageEmbeddingService service;

    @BeforeEach
    void setUp() {
        props.setDim(2);
        props.setBatchSize(2);
        props.setMaxAttempts(3);
        props.setInitialBackoff(Duration.ofMillis(1));
        props.setMaxBackoff(Duration.ofMillis(5));
        service = new PassageEmbeddingService(model, props);
    }

    private static float[] vec(float x) {
        return new float[]{x, -x};
    }

    @Test
    void embedsInBatchesPreservingOrder() {
        when(model.embed(List.of("a", "b"))).thenReturn(List.of(vec(1), vec(2)));
        when(model.embed(List.of("c", "d"))).thenReturn(List.of(vec(3), vec(4)));
        when(model.embed(List.of("e"))).thenReturn(List.of(vec(5)));

        List<float[]> vectors = service.embedAll(List.of("a", "b", "c", "d", "e"));

        assertThat(vectors).extracting(v -> v[0]).containsExactly(1f, 2f, 3f, 4f, 5f);
        verify(model, times(3)).embed(anyList());
    }

    @Test
    void emptyInputSkipsTheModel() {
        assertThat(service.embedAll(List.of())).isEmpty();
        verify(model, times(0)).embed(anyList());
    }

    @Test
    void retriesTransientFailures() {
        when(model.embed(List.of("q")))
            .thenThrow(new TransientAiException("503 Service Unavailable"))
            .thenReturn(List.of(vec(7)));

        assertThat(service.embed("q")).containsExactly(7f, -7f);
        verify(model, times(2)).embed(anyList());
    }

    @Test
    void rateLimitIsRetried() {
        when(model.embed(List.of("q")))
            .thenThrow(new NonTransientAiException("429 - {\"error\":{\"message\":\"Rate limit reached for "
                + "text-embedding-3-small\",\"type\":\"requests\",\"code\":\"rate_limit_exceeded\"}}"))
            .thenReturn(List.of(vec(7)));

        assertThat(service.embed("q")).containsExactly(7f, -7f);
        verify(model, times(2)).embed(anyList());
    }

    @Test
    void persistentRateLimitEndsInTransientEmbeddingException() {
        when(model.embed(anyList())).thenThrow(new NonTransientAiException(
            "429 - {\"error\":{\"code\":\"rate_limit_exceeded\"}}"));

        assertThatThrownBy(() -> service.embed("q")).isInstanceOf(TransientEmbeddingException.class);
        verify(model, times(3)).embed(anyList());
    }

    @Test
    void quotaExhaustionIsNeverRetried() {
        when(model.embed(anyList())).thenThrow(new NonTransientAiException(
            "429 - {\"error\":{\"message\":\"You exceeded your current quota, please check your plan and billing "
                + "details.\",\"code\":\"insufficient_quota\"}}"));

        assertThatThrownBy(() -> service.embed("q")).isInstanceOf(EmbeddingQuotaExceededException.class);
        verify(model, times(1)).embed(anyList());
    }

    @Test
    void otherProviderErrorsAreNotRetried() {
        when(model.embed(anyList())).thenThrow(new NonTransientAiException("401 invalid api key"));

        assertThatThrownBy(() -> service.embed("q"))
            .isInstanceOf(EmbeddingException.class)
            .isNotInstanceOf(TransientEmbeddingException.class);
        verify(model, times(1)).embed(anyList());
    }

    @Test
    void rejectsVectorsOfWrongDimension() {
        when(model.embed(anyList())).thenReturn(List.of(new float[]{1f, 2f, 3f}));

        assertThatThrownBy(() -> service.embed("q"))
            .isInstanceOf(EmbeddingException.class)
            .hasMessageContaining("dimension");
    }
}
