package com.acme.mxlegal.rules;

import com.acme.mxlegal.content.LegalContentLibrary;
import com.acme.mxlegal.content.ReferenceCatalog.OffenseEntry;
import com.acme.mxlegal.model.CriminalLiabilityResult;
import com.acme.mxlegal.model.CriminalLiabilityResult.OffenseProfile;
import com.acme.mxlegal.model.LegalError;
import com.acme.mxlegal.model.LegalException;
import com.acme.mxlegal.util.TextUtil;

import java.util.ArrayList;
import java.util.List;

public final class CriminalLiabilityCheck implements Check<List<String>, CriminalLiabilityResult> {

    private final LegalContentLibrary library;

    public CriminalLiabilityCheck(LegalContentLibrary library) { this.library = library; }

    @Override public String id() { return "criminal-liability"; }

    @Override
    public CriminalLiabilityResult run(List<String> input) {
        List<String> facts = TextUtil.normalizeFacts(input);
        if (facts.isEmpty()) throw new LegalException(LegalError.emptyFacts("facts"));
        String text = TextUtil.haystack(facts, null);

        List<OffenseProfile> offenses = new ArrayList<>();
        for (OffenseEntry e : library.catalog().offenses()) {
            if (e.predicate().test(text)) offenses.add(e.profile());
        }

        String recommendation = offenses.isEmpty()
                ? "No se identifican elementos que configuren delito."
                : "Se recomienda contactar inmediatamente con un abogado penalista especializado.";
        List<String> defenses = offenses.isEmpty() ? List.of() : library.catalog().criminalDefenses();
        return new CriminalLiabilityResult(List.copyOf(offenses), defenses, recommendation, library.disclaimer());
    }
}
