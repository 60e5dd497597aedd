package com.example.legalrag.client;

import com.example.legalrag.config.IngestionProperties;
import com.example.legalrag.dto.SparqlResultSet;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SparqlClientTest {

    private static final String ENDPOINT = "https://sparql.example.test/sparql";
    private static final String RESULTS = """
        {"head":{"vars":["celex","title","lang"]},
         "results":{"bindings":[
           {"celex":{"type":"literal","value":"32016R0679"},
            "title":{"type":"literal","value":"Regulamentul general privind protecția datelor"},
            "lang":{"type":"literal","value":"ro"}},
           {"celex":{"type":"literal","value":"32019L0790"},
            "title":{"type":"literal","value":"Directive on copyright"}}
         ]}}
        """;

    private final IngestionProperties props = new IngestionProperties();
    private final List<ClientRequest> requests = new ArrayList<>();

    @BeforeEach
    void setUp() {
        props.getSparql().setInitialBackoff(Duration.ofMillis(1));
        props.getSparql().setTimeout(Duration.ofSeconds(5));
        props.getSparql().setMaxAttempts(3);
    }

    private SparqlClient clientReturning(ClientResponse... responses) {
        AtomicInteger call = new AtomicInteger();
        WebClient webClient = WebClient.builder()
            .exchangeFunction(request -> {
                requests.add(request);
                return Mono.just(responses[Math.min(call.getAndIncrement(), responses.length - 1)]);
            })
            .build();
        return new SparqlClient(webClient, new ObjectMapper(), props);
    }

    private static ClientResponse json(String body) {
        return ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, SparqlClient.RESULTS_JSON + "; charset=utf-8")
            .body(body)
            .build();
    }

    @Test
    void postParsesBindingsIntoRows() {
        SparqlResultSet rs = clientReturning(json(RESULTS)).post(ENDPOINT, "SELECT * WHERE {}");

        assertThat(rs.rows()).hasSize(2);
        assertThat(rs.rows().get(0)).containsEntry("celex", "32016R0679").containsEntry("lang", "ro");
        assertThat(rs.rows().get(1)).isEqualTo(Map.of("celex", "32019L0790", "title", "Directive on copyright"));

        ClientRequest sent = requests.get(0);
        assertThat(sent.method()).isEqualTo(HttpMethod.POST);
        assertThat(sent.headers().getFirst(HttpHeaders.CONTENT_TYPE)).isEqualTo("application/sparql-query");
        assertThat(sent.headers().getFirst(HttpHeaders.ACCEPT)).startsWith(SparqlClient.RESULTS_JSON);
    }

    @Test
    void getSendsQueryAndFormatParameters() {
        SparqlResultSet rs = clientReturning(json("{\"results\":{\"bindings\":[]}}"))
            .get(ENDPOINT, "SELECT ?x WHERE { ?x ?p ?o }");

        assertThat(rs.isEmpty()).isTrue();
        String query = requests.get(0).url().getRawQuery();
        assertThat(query).contains("query=SELECT").contains("format=application%2Fsparql-results%2Bjson");
    }

    @Test
    void rejectsHtmlResponses() {
        ClientResponse html = ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, "text/html")
            .body("<html>maintenance</html>")
            .build();

        assertThatThrownBy(() -> clientReturning(html).post(ENDPOINT, "SELECT"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Unexpected content-type")
            .hasMessageContaining("maintenance");
    }

    @Test
    void retriesServerErrorsThenSucceeds() {
        SparqlResultSet rs = clientReturning(
            ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build(),
            ClientResponse.create(HttpStatus.BAD_GATEWAY).build(),
            json(RESULTS)).post(ENDPOINT, "SELECT");

        assertThat(rs.rows()).hasSize(2);
        assertThat(requests).hasSize(3);
    }

    @Test
    void doesNotRetryClientErrors() {
        SparqlClient client = clientReturning(ClientResponse.create(HttpStatus.BAD_REQUEST).build());

        assertThatThrownBy(() -> client.post(ENDPOINT, "SELECT"))
            .isInstanceOf(WebClientResponseException.BadRequest.class);
        assertThat(requests).hasSize(1);
    }

    @Test
    void backoffIsCappedIndependentlyOfTheRequestTimeout() {
        props.getSparql().setTimeout(Duration.ofSeconds(60));
        props.getSparql().setMaxBackoff(Duration.ofSeconds(4));

        RetryBackoffSpec spec = clientReturning().retrySpec(ENDPOINT);

        assertThat(spec.maxBackoff).isEqualTo(Duration.ofSeconds(4));
        assertThat(spec.maxAttempts).isEqualTo(2);
    }
}
