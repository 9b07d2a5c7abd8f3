package com.acme.mxlegal.rules;

import com.acme.mxlegal.content.KeywordPredicate;
import com.acme.mxlegal.content.LegalContentLibrary;
import com.acme.mxlegal.model.CaseFacts;
import com.acme.mxlegal.model.Enums.LegalArea;
import com.acme.mxlegal.util.TextUtil;

import java.util.List;
import java.util.Map;

public final class AreaClassifier implements Check<CaseFacts, LegalArea> {

    private final LegalContentLibrary library;

    public AreaClassifier(LegalContentLibrary library) { this.library = library; }

    @Override public String id() { return "area-classifier"; }

    @Override
    public LegalArea run(CaseFacts input) { return classify(input.facts(), input.legalQuestion()); }

    public LegalArea classify(List<String> facts, String question) {
        String text = TextUtil.haystack(TextUtil.normalizeFacts(facts), question);
        for (Map.Entry<LegalArea, KeywordPredicate> e : library.catalog().areaKeywords().entrySet()) {
            if (e.getValue().test(text)) return e.getKey();
        }
        return LegalArea.CIVIL;
    }
}
