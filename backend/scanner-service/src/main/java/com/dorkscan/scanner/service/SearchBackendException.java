package com.dorkscan.scanner.service;

public class SearchBackendException extends RuntimeException {

    private final int status;

    public SearchBackendException(String message, int status) {
        super(message);
        this.status = status;
    }

    public SearchBackendException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    public int getStatus() {
        return status;
    }
}
