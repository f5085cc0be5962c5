package com.dorkscan.scanner.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class UrlDeduplicator {

    private final Set<String> seen = new HashSet<>();

    /**
     * Returns the candidates not seen before, in their original order, and marks all of them
     * as seen. Check and insert happen under one lock.
     */
    public synchronized List<String> filterNew(List<String> candidates) {
        List<String> fresh = new ArrayList<>();
        for (String url : candidates) {
            if (url != null && !url.isBlank() && seen.add(url)) {
                fresh.add(url);
            }
        }
        return fresh;
    }

    public synchronized boolean hasSeen(String url) {
        return seen.contains(url);
    }

    public synchronized int size() {
        return seen.size();
    }
}
