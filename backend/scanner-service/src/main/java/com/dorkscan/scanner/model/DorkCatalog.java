package com.dorkscan.scanner.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record DorkCatalog(Map<String, DorkCategory> categories) {

    public DorkCatalog {
        categories = Collections.unmodifiableMap(new LinkedHashMap<>(categories == null ? Map.of() : categories));
    }

    public static DorkCatalog of(List<DorkCategory> entries) {
        Map<String, DorkCategory> map = new LinkedHashMap<>();
        for (DorkCategory c : entries) {
            map.put(c.name(), c);
        }
        return new DorkCatalog(map);
    }

    public Optional<DorkCategory> find(String name) {
        return Optional.ofNullable(categories.get(name));
    }

    public List<String> names() {
        return List.copyOf(categories.keySet());
    }

    public boolean isEmpty() {
        return categories.isEmpty();
    }
}
