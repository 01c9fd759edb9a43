package com.factguard.domain.correction.service;

public class CorrectionRewriteException extends RuntimeException {

    public CorrectionRewriteException(String message) {
        super(message);
    }

    public CorrectionRewriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
