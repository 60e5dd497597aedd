package com.example.legalrag.client;

import com.example.legalrag.config.IngestionProperties;
import com.example.legalrag.dto.SparqlResultSet;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.util.retry.RetryBackoffSpec;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Executes SPARQL SELECT queries against a Virtuoso-style endpoint and returns the bindings as plain strings.
 */
@Component
public class SparqlClient {

    static final String RESULTS_JSON = "application/sparql-results+json";
    private static final String ACCEPT = RESULTS_JSON + ", application/json;q=0.9, */*;q=0.1";
    private static final MediaType SPARQL_QUERY = MediaType.parseMediaType("application/sparql-query");

    private final WebClient webClient;
    private final ObjectMapper mapper;
    private final IngestionProperties props;

    public SparqlClient(WebClient eurLexWebClient, ObjectMapper mapper, IngestionProperties props) {
        this.webClient = eurLexWebClient;
        this.mapper = mapper;
        this.props = props;
    }

    /** Sends the query as the raw request body. */
    public SparqlResultSet post(String endpoint, String query) {
        ResponseEntity<String> response = webClient.post()
            .uri(endpoint)
            .contentType(SPARQL_QUERY)
            .header(HttpHeaders.ACCEPT, ACCEPT)
            .bodyValue(query)
            .retrieve()
            .toEntity(String.class)
            .timeout(props.getSparql().getTimeout())
            .retryWhen(retrySpec(endpoint))
            .block();
        return parse(endpoint, response);
    }

    /** Sends the query as a URL parameter, with an explicit {@code format} for endpoints that ignore Accept. */
    public SparqlResultSet get(String endpoint, String query) {
        URI uri = UriComponentsBuilder.fromUriString(endpoint)
            .queryParam("query", "{query}")
            .queryParam("format", "{format}")
            .encode()
            .buildAndExpand(query, RESULTS_JSON)
            .toUri();

        ResponseEntity<String> response = webClient.get()
            .uri(uri)
            .header(HttpHeaders.ACCEPT, ACCEPT)
            .retrieve()
            .toEntity(String.class)
            .timeout(props.getSparql().getTimeout())
            .retryWhen(retrySpec(endpoint))
            .block();
        return parse(endpoint, response);
    }

    RetryBackoffSpec retrySpec(String endpoint) {
        IngestionProperties.Sparql sparql = props.getSparql();
        return HttpRetries.transientBackoff(sparql.getMaxAttempts(), sparql.getInitialBackoff(),
            sparql.getMaxBackoff(), "SPARQL " + endpoint);
    }

    private SparqlResultSet parse(String endpoint, ResponseEntity<String> response) {
        if (response == null || response.getBody() == null) {
            throw new IllegalStateException("Empty response from " + endpoint);
        }
        MediaType contentType = response.getHeaders().getContentType();
        String ctype = contentType == null ? "" : contentType.toString().toLowerCase(Locale.ROOT);
        if (!ctype.contains(RESULTS_JSON) && !ctype.contains(MediaType.APPLICATION_JSON_VALUE)) {
            String body = response.getBody();
            String preview = body.substring(0, Math.min(200, body.length()));
            throw new IllegalStateException("Unexpected content-type at " + endpoint + ": " + ctype + " preview=" + preview);
        }
        try {
            JsonNode bindings = mapper.readTree(response.getBody()).path("results").path("bindings");
            List<Map<String, String>> rows = new ArrayList<>(bindings.size());
            for (JsonNode binding : bindings) {
                Map<String, String> row = new LinkedHashMap<>();
                binding.fields().forEachRemaining(e -> row.put(e.getKey(), e.getValue().path("value").asText()));
                rows.add(row);
            }
            return new SparqlResultSet(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed SPARQL JSON from " + endpoint, e);
        }
    }
}
