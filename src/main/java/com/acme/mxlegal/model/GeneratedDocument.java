package com.acme.mxlegal.model;

import com.acme.mxlegal.model.Enums.DocumentType;

import java.time.Instant;
import java.util.List;

public record GeneratedDocument(
        DocumentType documentType,
        String renderedText,
        List<Section> sections,
        Instant generatedAt
) {
    public GeneratedDocument {
        sections = List.copyOf(sections);
    }

    public record Section(String title, String body) {}
}
