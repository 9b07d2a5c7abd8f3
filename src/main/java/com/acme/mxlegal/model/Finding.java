package com.acme.mxlegal.model;

import com.acme.mxlegal.model.Enums.RiskLevel;

import java.util.List;

public record Finding(List<String> citedProvisions, String conclusion, RiskLevel riskLevel, List<String> recommendedActions) {
    public Finding {
        citedProvisions = List.copyOf(citedProvisions);
        recommendedActions = List.copyOf(recommendedActions);
    }

    public static Finding low(String conclusion, List<String> provisions, List<String> actions) { return new Finding(provisions, conclusion, RiskLevel.LOW, actions); }
    public static Finding medium(String conclusion, List<String> provisions, List<String> actions) { return new Finding(provisions, conclusion, RiskLevel.MEDIUM, actions); }
    public static Finding high(String conclusion, List<String> provisions, List<String> actions) { return new Finding(provisions, conclusion, RiskLevel.HIGH, actions); }
}
