package com.factguard.domain.verification.service;

public class SourceUnavailableException extends RuntimeException {

    private final boolean timeout;

    public SourceUnavailableException(String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }

    public SourceUnavailableException(String message) {
        super(message);
        this.timeout = false;
    }

    /** Only timeouts are worth a retry. */
    public boolean isTimeout() {
        return timeout;
    }
}
