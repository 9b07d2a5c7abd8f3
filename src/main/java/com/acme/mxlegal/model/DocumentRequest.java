package com.acme.mxlegal.model;

import com.acme.mxlegal.model.Enums.DocumentType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record DocumentRequest(DocumentType documentType, Map<String, Object> fields) {
    public DocumentRequest {
        // LinkedHashMap tolerates null values, which the engine reports as missing
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
