package com.acme.mxlegal.rules;

import com.acme.mxlegal.content.LegalContentLibrary;
import com.acme.mxlegal.content.ReferenceCatalog.RequisiteEntry;
import com.acme.mxlegal.model.ContractValidityResult;
import com.acme.mxlegal.model.LegalError;
import com.acme.mxlegal.model.LegalException;
import com.acme.mxlegal.util.TextUtil;

import java.util.*;

public final class ContractValidityCheck implements Check<List<String>, ContractValidityResult> {

    private final LegalContentLibrary library;

    public ContractValidityCheck(LegalContentLibrary library) { this.library = library; }

    @Override public String id() { return "contract-validity"; }

    @Override
    public ContractValidityResult run(List<String> contractTerms) {
        List<String> terms = TextUtil.normalizeFacts(contractTerms);
        if (terms.isEmpty()) throw new LegalException(LegalError.emptyFacts("contract_terms"));
        String text = TextUtil.haystack(terms, null);

        Map<String, Boolean> requirements = new LinkedHashMap<>();
        List<String> issues = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        for (RequisiteEntry req : library.catalog().contractRequisites()) {
            boolean met = req.predicate().test(text);
            requirements.put(req.requisite(), met);
            if (!met) {
                issues.add(req.issue());
                recommendations.add(req.recommendation());
            }
        }

        return new ContractValidityResult(issues.isEmpty(), Collections.unmodifiableMap(requirements), List.copyOf(issues),
                library.catalog().contractArticles(), List.copyOf(recommendations), library.disclaimer());
    }
}
