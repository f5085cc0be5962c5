package com.dorkscan.scanner.model;

import java.util.List;

public record DorkCategory(String name,
        String description,
        RiskLevel risk,
        boolean sensitive,
        List<String> patterns) {

    public DorkCategory {
        description = description == null ? "" : description;
        risk = risk == null ? RiskLevel.UNKNOWN : risk;
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    public static DorkCategory unclassified(String name, List<String> patterns) {
        return new DorkCategory(name, "", RiskLevel.UNKNOWN, false, patterns);
    }

    public boolean isSensitive() {
        return sensitive || risk.isElevated();
    }
}
