package com.dorkscan.scanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One recorded search hit. Serialized as a JSON line and as a CSV row; see {@link #CSV_COLUMNS}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"timestamp", "category", "dork", "query", "url", "final_url", "status", "title",
        "content_snippet", "sensitive_hint", "error"})
public record Finding(BigDecimal timestamp,
        String category,
        String dork,
        String query,
        String url,
        @JsonProperty("final_url") String finalUrl,
        @JsonIgnore Integer httpStatus,
        String title,
        @JsonProperty("content_snippet") String contentSnippet,
        @JsonProperty("sensitive_hint") boolean sensitiveHint,
        String error) {

    public static final List<String> CSV_COLUMNS = List.of(
            "timestamp", "category", "dork", "query", "url", "status", "title", "sensitive_hint", "error");

    public Finding {
        if (url == null || url.isBlank()) throw new IllegalArgumentException("finding url must not be empty");
    }

    public static Finding of(DorkQuery query, String url, long epochMillis) {
        return new Finding(BigDecimal.valueOf(epochMillis, 3), query.category(), query.pattern(), query.query(),
                url, null, null, null, null, false, null);
    }

    /**
     * Copies snapshot data onto this finding. The search URL is kept as {@code url}; the resolved
     * location is only recorded when a redirect changed it.
     */
    public Finding withSnapshot(PageSnapshot snapshot, boolean sensitive) {
        String resolved = snapshot.url() != null && !snapshot.url().equals(url) ? snapshot.url() : null;
        return new Finding(timestamp, category, dork, query, url, resolved, snapshot.status(), snapshot.title(),
                snapshot.contentSnippet(), sensitiveHint || sensitive, snapshot.error());
    }

    /** Either the HTTP status, {@code "error"} for a failed snapshot, or null when nothing was fetched. */
    @JsonProperty("status")
    public Object status() {
        if (error != null) return "error";
        return httpStatus;
    }

    public Map<String, String> csvRow() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("timestamp", timestamp.toPlainString());
        row.put("category", nullToEmpty(category));
        row.put("dork", nullToEmpty(dork));
        row.put("query", nullToEmpty(query));
        row.put("url", url);
        row.put("status", status() == null ? "" : String.valueOf(status()));
        row.put("title", nullToEmpty(title));
        row.put("sensitive_hint", sensitiveHint ? "True" : "False");
        row.put("error", nullToEmpty(error));
        return row;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
