package com.dorkscan.scanner.service;

import com.dorkscan.scanner.model.SearchOutcome;
import reactor.core.publisher.Mono;

public interface SearchProvider {

    String name();

    /** False when the provider lacks what it needs to run (e.g. credentials); the chain skips it. */
    boolean isAvailable();

    default int requestSize(int desired) {
        return desired;
    }

    Mono<SearchOutcome> search(String query, int desired);
}
