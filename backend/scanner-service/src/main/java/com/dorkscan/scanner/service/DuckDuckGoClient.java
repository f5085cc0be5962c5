package com.dorkscan.scanner.service;

import com.dorkscan.scanner.config.DuckDuckGoProperties;
import com.dorkscan.scanner.config.ScanProperties;
import com.dorkscan.scanner.model.SearchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Scrapes the DuckDuckGo HTML endpoint. Never errors: every failure turns into
 * {@link SearchOutcome#tryNext(String)}.
 */
@Service
public class DuckDuckGoClient implements SearchProvider {

    private static final Logger log = LoggerFactory.getLogger(DuckDuckGoClient.class);

    private final WebClient duck;
    private final DuckDuckGoResultParser parser;
    private final int pageSize;
    private final Duration timeout;

    public DuckDuckGoClient(@Qualifier("duckDuckGoWebClient") WebClient duckDuckGoWebClient,
                            DuckDuckGoResultParser parser,
                            DuckDuckGoProperties properties,
                            ScanProperties scan) {
        this.duck = duckDuckGoWebClient;
        this.parser = parser;
        this.pageSize = properties.pageSize();
        this.timeout = scan.searchTimeout();
    }

    @Override
    public String name() {
        return "duckduckgo";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    // one HTML page holds more links than the API returns; ask wide so dedup still leaves enough
    @Override
    public int requestSize(int desired) {
        return Math.max(desired, pageSize);
    }

    @Override
    public Mono<SearchOutcome> search(String query, int desired) {
        return duck.get()
                .uri(b -> b.path("/html/").queryParam("q", "{q}").build(query))
                .exchangeToMono(resp -> {
                    int status = resp.statusCode().value();
                    if (status == HttpStatus.FORBIDDEN.value()) {
                        log.warn("DuckDuckGo answered 403 Forbidden for '{}'; automated requests are being blocked", query);
                        return resp.releaseBody().thenReturn(SearchOutcome.tryNext("forbidden"));
                    }
                    if (!resp.statusCode().is2xxSuccessful()) {
                        log.warn("DuckDuckGo answered {} for '{}'", status, query);
                        return resp.releaseBody().thenReturn(SearchOutcome.tryNext("http " + status));
                    }
                    return resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(html -> parser.parse(html, desired));
                })
                .timeout(timeout)
                .onErrorResume(e -> {
                    log.warn("DuckDuckGo request failed for '{}': {}", query, Failures.describe(e, timeout));
                    return Mono.just(SearchOutcome.tryNext("network error"));
                });
    }
}
