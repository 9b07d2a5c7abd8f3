package com.acme.mxlegal.rules;

import com.acme.mxlegal.content.LegalContentLibrary;
import com.acme.mxlegal.content.ReferenceCatalog.RightEntry;
import com.acme.mxlegal.model.LegalError;
import com.acme.mxlegal.model.LegalException;
import com.acme.mxlegal.model.RightsCheckResult;
import com.acme.mxlegal.util.TextUtil;

import java.util.ArrayList;
import java.util.List;

public final class ConstitutionalRightsCheck implements Check<String, RightsCheckResult> {

    private final LegalContentLibrary library;

    public ConstitutionalRightsCheck(LegalContentLibrary library) { this.library = library; }

    @Override public String id() { return "constitutional-rights"; }

    @Override
    public RightsCheckResult run(String situation) {
        if (situation == null || situation.isBlank()) {
            throw new LegalException(LegalError.invalidInput(List.of("situation")));
        }
        String text = TextUtil.fold(situation);

        List<String> rights = new ArrayList<>();
        List<String> articles = new ArrayList<>();
        for (RightEntry r : library.catalog().rights()) {
            if (r.predicate().test(text)) {
                rights.add(r.right());
                articles.add(r.article());
            }
        }

        boolean amparo = !rights.isEmpty();
        String recommendation = amparo
                ? "Se recomienda la promoción de juicio de amparo para la protección de los derechos fundamentales posiblemente violados."
                : "No se identifican violaciones constitucionales evidentes.";
        return new RightsCheckResult(List.copyOf(rights), List.copyOf(articles), amparo, recommendation, library.disclaimer());
    }
}
