package com.example.legalrag.service;

import com.example.legalrag.client.EurLexClient;
import com.example.legalrag.client.HttpRetries;
import com.example.legalrag.config.IngestionProperties;
import com.example.legalrag.dto.DiscoveryRecord;
import com.example.legalrag.exception.FetchException;
import com.example.legalrag.util.Attempt;
import com.example.legalrag.util.FallbackChain;
import com.example.legalrag.util.FallbackChain.Strategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentFetchService {

    private final EurLexClient client;
    private final IngestionProperties props;

    /**
     * Downloads the HTML of {@code record}. When the record's own language variant fails and a fallback language
     * is configured, the fallback variant is tried once (with its own retries) before giving up.
     *
     * @throws FetchException when every variant failed
     */
    public String fetch(DiscoveryRecord record) {
        List<Strategy<String>> variants = new ArrayList<>();
        variants.add(FallbackChain.strategy(record.language(), () -> client.fetchHtml(record.sourceLocation())));

        String fallback = props.getFallbackLanguage();
        if (fallback != null && !fallback.equalsIgnoreCase(record.language())) {
            String fallbackUrl = props.documentUrl(record.id(), fallback);
            variants.add(FallbackChain.strategy(fallback, () -> {
                log.warn("[Fetch] {} {} not available, trying {}", record.id(), record.language(), fallback);
                return client.fetchHtml(fallbackUrl);
            }));
        }

        Attempt<String> attempt = FallbackChain.firstSuccess(variants);
        if (attempt instanceof Attempt.Failure<String> failure) {
            Throwable cause = failure.cause();
            throw new FetchException(record.id(), HttpRetries.statusOf(cause),
                "Failed to fetch " + record.id() + ": " + cause.getMessage(), cause);
        }
        return ((Attempt.Success<String>) attempt).value();
    }

    /** Fetches a single language variant, without fallback. */
    public String fetch(String documentId, String language) {
        try {
            return client.fetchHtml(props.documentUrl(documentId, language));
        } catch (RuntimeException e) {
            throw new FetchException(documentId, HttpRetries.statusOf(e),
                "Failed to fetch " + documentId + " (" + language + "): " + e.getMessage(), e);
        }
    }
}
