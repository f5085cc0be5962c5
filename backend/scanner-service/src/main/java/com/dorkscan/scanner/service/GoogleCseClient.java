package com.dorkscan.scanner.service;

import com.dorkscan.scanner.config.GoogleCseProperties;
import com.dorkscan.scanner.config.ScanProperties;
import com.dorkscan.scanner.model.GoogleCseResponse;
import com.dorkscan.scanner.model.SearchOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Google Custom Search JSON API. Errors surface as {@link SearchBackendException}; the chain
 * decides what to do with them.
 */
@Service
public class GoogleCseClient implements SearchProvider {

    static final int MAX_PAGE_SIZE = 10;
    private static final String SEARCH_PATH = "/customsearch/v1";

    private final WebClient cse;
    private final GoogleCseProperties properties;
    private final Duration timeout;
    private final ObjectMapper om;

    public GoogleCseClient(@Qualifier("googleCseWebClient") WebClient googleCseWebClient,
                           GoogleCseProperties properties,
                           ScanProperties scan,
                           ObjectMapper om) {
        this.cse = googleCseWebClient;
        this.properties = properties;
        this.timeout = scan.searchTimeout();
        this.om = om;
    }

    @Override
    public String name() {
        return "google-cse";
    }

    @Override
    public boolean isAvailable() {
        return properties.hasCredentials();
    }

    @Override
    public int requestSize(int desired) {
        return Math.max(1, Math.min(desired, MAX_PAGE_SIZE));
    }

    @Override
    public Mono<SearchOutcome> search(String query, int desired) {
        int num = requestSize(desired);
        return cse.get()
                .uri(b -> b.path(SEARCH_PATH)
                        .queryParam("key", "{key}")
                        .queryParam("cx", "{cx}")
                        .queryParam("q", "{q}")
                        .queryParam("num", "{num}")
                        .build(properties.apiKey(), properties.cx(), query, num))
                .exchangeToMono(resp -> {
                    if (resp.statusCode().is2xxSuccessful()) {
                        return resp.bodyToMono(GoogleCseResponse.class)
                                .map(this::toOutcome)
                                .defaultIfEmpty(SearchOutcome.tryNext("empty response"));
                    }
                    return resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(body -> Mono.error(toException(resp.statusCode(), body)));
                })
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof SearchBackendException),
                        e -> new SearchBackendException("network error: " + Failures.describe(e, timeout), e));
    }

    private SearchOutcome toOutcome(GoogleCseResponse response) {
        if (response.items() == null) return SearchOutcome.tryNext("no items");
        List<String> links = response.items().stream()
                .map(GoogleCseResponse.Item::link)
                .filter(Objects::nonNull)
                .filter(link -> !link.isBlank())
                .toList();
        return SearchOutcome.hits(links);
    }

    SearchBackendException toException(HttpStatusCode status, String body) {
        if (status.value() == HttpStatus.BAD_REQUEST.value()) {
            return new SearchBackendException("google cse api error (" + status.value() + "): "
                    + upstreamMessage(body), status.value());
        }
        String excerpt = body.length() > 200 ? body.substring(0, 200) : body;
        return new SearchBackendException("google cse api returned an unexpected status code: "
                + status.value() + " - " + excerpt, status.value());
    }

    private String upstreamMessage(String body) {
        try {
            JsonNode message = om.readTree(body).path("error").path("message");
            return message.isTextual() ? message.asText() : "unknown api error.";
        } catch (JsonProcessingException e) {
            return "unknown api error.";
        }
    }
}
