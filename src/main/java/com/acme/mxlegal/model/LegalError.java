package com.acme.mxlegal.model;

import com.acme.mxlegal.model.Enums.ErrorKind;

import java.util.List;

public record LegalError(ErrorKind kind, String message, List<String> fields) {
    public LegalError {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static LegalError unknownDocumentType(String value) {
        return new LegalError(ErrorKind.UNKNOWN_DOCUMENT_TYPE, "Unknown document type: " + value, List.of("documentType"));
    }

    public static LegalError unknownArea(String value) {
        return new LegalError(ErrorKind.UNKNOWN_AREA, "Unknown area of law: " + value, List.of("area"));
    }

    public static LegalError missingFields(List<String> fields) {
        return new LegalError(ErrorKind.MISSING_REQUIRED_FIELD, "Missing required field(s): " + String.join(", ", fields), fields);
    }

    public static LegalError emptyFacts(String field) {
        return new LegalError(ErrorKind.EMPTY_FACT_SET, "No non-blank entries in '" + field + "'", List.of(field));
    }

    public static LegalError invalidInput(List<String> fields) {
        return new LegalError(ErrorKind.INVALID_INPUT, "Invalid or missing input: " + String.join(", ", fields), fields);
    }

    public static LegalError cancelled(String requestId) {
        return new LegalError(ErrorKind.CANCELLED, "Request " + requestId + " was cancelled", List.of());
    }
}
