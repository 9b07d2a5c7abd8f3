/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: MX Legal Assist
 */

package com.acme.mxlegal.rules;

import com.acme.mxlegal.content.LegalContentLibrary;
import com.acme.mxlegal.content.Rule;
import com.acme.mxlegal.content.RuleTable;
import com.acme.mxlegal.model.AssessmentResult;
import com.acme.mxlegal.model.CaseFacts;
import com.acme.mxlegal.model.Enums.LegalArea;
import com.acme.mxlegal.model.Finding;
import com.acme.mxlegal.model.LegalError;
import com.acme.mxlegal.model.LegalException;
import com.acme.mxlegal.util.TextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public final class LegalRuleEvaluator implements Check<CaseFacts, AssessmentResult> {

    private static final Logger log = LoggerFactory.getLogger(LegalRuleEvaluator.class);

    private final LegalContentLibrary library;

    public LegalRuleEvaluator(LegalContentLibrary library) { this.library = library; }

    @Override public String id() { return "case-analysis"; }

    @Override
    public AssessmentResult run(CaseFacts input) { return evaluate(input); }

    public AssessmentResult evaluate(CaseFacts caseFacts) {
        RuleTable table = library.getRuleTable(caseFacts.area());

        List<String> facts = TextUtil.normalizeFacts(caseFacts.facts());
        if (facts.isEmpty()) throw new LegalException(LegalError.emptyFacts("facts"));

        String text = TextUtil.haystack(facts, caseFacts.legalQuestion());
        AssessmentResultBuilder out = new AssessmentResultBuilder(table.area());
        for (Rule r : table.rules()) {
            if (r.predicate().test(text)) {
                log.debug("Rule '{}' matched for area {}", r.id(), table.area());
                out.addFinding(r.finding());
            }
        }
        if (out.isEmpty()) out.addFinding(noMatch(table.area()));
        return out.build(library.disclaimer());
    }

    Finding noMatch(LegalArea area) {
        return Finding.low("No se identificaron patrones suficientes en los hechos para emitir una orientación en materia "
                        + area.wire() + ".",
                List.of(), library.catalog().genericRecommendations());
    }
}
