package com.dorkscan.scanner.model;

public record PageSnapshot(String url,
        Integer status,
        String title,
        String contentSnippet,
        String error) {

    public static PageSnapshot ok(String url, int status, String title, String contentSnippet) {
        return new PageSnapshot(url, status, title, contentSnippet, null);
    }

    public static PageSnapshot failed(String url, String error) {
        return new PageSnapshot(url, null, null, null,
                error == null || error.isBlank() ? "unknown error" : error);
    }

    public boolean isError() {
        return error != null;
    }
}
