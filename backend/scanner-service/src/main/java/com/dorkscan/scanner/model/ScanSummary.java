package com.dorkscan.scanner.model;

import java.time.Duration;
import java.util.List;

public record ScanSummary(int queriesRun,
        int emptyQueries,
        int skippedCategories,
        List<Finding> findings,
        Duration elapsed,
        boolean cancelled) {

    public ScanSummary {
        findings = List.copyOf(findings);
    }

    public long sensitiveFindings() {
        return findings.stream().filter(Finding::sensitiveHint).count();
    }
}
