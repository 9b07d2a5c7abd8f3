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

import com.acme.mxlegal.model.AssessmentResult;
import com.acme.mxlegal.model.Enums.LegalArea;
import com.acme.mxlegal.model.Finding;
import com.acme.mxlegal.util.RiskUtil;

import java.util.ArrayList;
import java.util.List;

public final class AssessmentResultBuilder {
    private final LegalArea area;
    private final List<Finding> findings = new ArrayList<>();

    public AssessmentResultBuilder(LegalArea area) { this.area = area; }

    public void addFinding(Finding f) { if (f != null) findings.add(f); }

    public boolean isEmpty() { return findings.isEmpty(); }

    public AssessmentResult build(String disclaimer) {
        if (disclaimer == null || disclaimer.isBlank()) throw new IllegalStateException("disclaimer is mandatory");
        return new AssessmentResult(area, List.copyOf(findings), RiskUtil.worst(findings), disclaimer);
    }
}
