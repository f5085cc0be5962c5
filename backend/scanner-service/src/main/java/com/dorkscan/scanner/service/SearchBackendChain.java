package com.dorkscan.scanner.service;

import com.dorkscan.scanner.model.SearchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tries search providers in order and stops at the first one that returns URLs. Providers
 * that are unavailable are skipped; a provider error counts as "no results" and moves on.
 */
@Service
public class SearchBackendChain {

    private static final Logger log = LoggerFactory.getLogger(SearchBackendChain.class);

    private final List<SearchProvider> providers;

    @Autowired
    public SearchBackendChain(GoogleCseClient googleCse, DuckDuckGoClient duckDuckGo) {
        this(List.of(googleCse, duckDuckGo));
        if (!googleCse.isAvailable()) {
            log.info("No Google CSE credentials configured; searching with DuckDuckGo only");
        }
    }

    public SearchBackendChain(List<SearchProvider> providers) {
        this.providers = List.copyOf(providers);
    }

    public Mono<List<String>> search(String query, int desired) {
        return Flux.fromIterable(providers)
                .filter(SearchProvider::isAvailable)
                .concatMap(provider -> attempt(provider, query, desired))
                .filter(SearchOutcome::isHit)
                .next()
                .map(SearchOutcome::urls)
                .defaultIfEmpty(List.of());
    }

    private Mono<SearchOutcome> attempt(SearchProvider provider, String query, int desired) {
        log.info("Trying {} for '{}'", provider.name(), query);
        return provider.search(query, provider.requestSize(desired))
                .defaultIfEmpty(SearchOutcome.tryNext("no response"))
                .onErrorResume(e -> {
                    log.warn("{} error for '{}': {}", provider.name(), query, e.getMessage());
                    return Mono.just(SearchOutcome.tryNext(e.getMessage()));
                })
                .doOnNext(outcome -> {
                    if (outcome.isHit()) {
                        log.info("{} returned {} links for '{}'", provider.name(), outcome.urls().size(), query);
                    } else {
                        log.info("{} returned no results for '{}' ({})", provider.name(), query, outcome.reason());
                    }
                });
    }

    public String describe() {
        return providers.stream()
                .filter(SearchProvider::isAvailable)
                .map(SearchProvider::name)
                .collect(Collectors.joining(" -> "));
    }
}
