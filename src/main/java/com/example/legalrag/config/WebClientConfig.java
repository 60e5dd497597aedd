package com.example.legalrag.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Shared client for the SPARQL endpoints and EUR-Lex pages. Socket timeouts here are an outer bound;
 * each call applies its own, shorter per-attempt timeout.
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_BODY_BYTES = 32 * 1024 * 1024;

    @Bean
    public WebClient eurLexWebClient(IngestionProperties props) {
        IngestionProperties.Http http = props.getHttp();
        long socketTimeoutMs = http.getSocketTimeout().toMillis();

        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) http.getConnectTimeout().toMillis())
            .responseTimeout(http.getSocketTimeout())
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(socketTimeoutMs, TimeUnit.MILLISECONDS))
                .addHandlerLast(new WriteTimeoutHandler(socketTimeoutMs, TimeUnit.MILLISECONDS)));

        return WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
            .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_BODY_BYTES))
            .build();
    }
}
