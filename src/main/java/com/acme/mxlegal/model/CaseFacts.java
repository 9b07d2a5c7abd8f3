package com.acme.mxlegal.model;

import com.acme.mxlegal.model.Enums.LegalArea;

import java.util.List;

public record CaseFacts(List<String> facts, String legalQuestion, LegalArea area) {
    public CaseFacts {
        facts = facts == null ? List.of() : List.copyOf(facts);
        legalQuestion = legalQuestion == null ? "" : legalQuestion;
    }
}
