package com.acme.mxlegal.model;

import com.acme.mxlegal.model.Enums.LegalArea;
import com.acme.mxlegal.model.Enums.RiskLevel;

import java.util.List;

public record AssessmentResult(
        LegalArea area,
        List<Finding> findings,
        RiskLevel overallRisk,
        String disclaimer
) {}
