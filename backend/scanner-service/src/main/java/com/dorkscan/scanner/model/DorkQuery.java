package com.dorkscan.scanner.model;

public record DorkQuery(String category, String pattern, String query) {

    public static DorkQuery build(String category, String pattern, String target) {
        String p = pattern == null ? "" : pattern;
        String t = target == null ? "" : target.trim();
        String literal = t.isEmpty() ? p : "site:" + t + " " + p;
        return new DorkQuery(category, p, literal);
    }
}
