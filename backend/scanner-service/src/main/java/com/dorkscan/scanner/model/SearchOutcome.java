package com.dorkscan.scanner.model;

import java.util.List;

/**
 * What one search strategy produced: either result URLs, or a reason to move on to the next
 * strategy. An empty URL list is always a "try next".
 */
public record SearchOutcome(List<String> urls, String reason) {

    public SearchOutcome {
        urls = urls == null ? List.of() : List.copyOf(urls);
    }

    public static SearchOutcome hits(List<String> urls) {
        return urls == null || urls.isEmpty()
                ? tryNext("no results")
                : new SearchOutcome(urls, null);
    }

    public static SearchOutcome tryNext(String reason) {
        return new SearchOutcome(List.of(), reason);
    }

    public boolean isHit() {
        return !urls.isEmpty();
    }
}
