package com.acme.mxlegal.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Outcome<T>(T value, LegalError error) {
    public Outcome {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("Outcome needs exactly one of value or error");
        }
    }

    public static <T> Outcome<T> ok(T value) { return new Outcome<>(Objects.requireNonNull(value), null); }
    public static <T> Outcome<T> failure(LegalError error) { return new Outcome<>(null, Objects.requireNonNull(error)); }

    @JsonIgnore
    public boolean isOk() { return error == null; }
}
