package com.acme.mxlegal.model;

public class LegalException extends RuntimeException {
    private final LegalError error;

    public LegalException(LegalError error) {
        super(error.message());
        this.error = error;
    }

    public LegalError error() { return error; }
}
