package com.example.legalrag.client;

import com.example.legalrag.config.IngestionProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class EurLexClient {

    private final WebClient webClient;
    private final IngestionProperties props;

    public EurLexClient(WebClient eurLexWebClient, IngestionProperties props) {
        this.webClient = eurLexWebClient;
        this.props = props;
    }

    /**
     * GETs the HTML rendition at {@code url}. Each attempt is bounded by the configured timeout; transient
     * failures are retried, the last failure is rethrown as-is.
     */
    public String fetchHtml(String url) {
        IngestionProperties.Fetch fetch = props.getFetch();
        return webClient.get()
            .uri(url)
            .header(HttpHeaders.ACCEPT, MediaType.TEXT_HTML_VALUE)
            .retrieve()
            .bodyToMono(String.class)
            .defaultIfEmpty("")
            .timeout(fetch.getTimeout())
            .retryWhen(HttpRetries.transientBackoff(fetch.getMaxAttempts(), fetch.getInitialBackoff(),
                fetch.getMaxBackoff(), url))
            .block();
    }
}
