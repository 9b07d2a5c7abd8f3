package com.acme.mxlegal.model;

import java.util.List;

public record CriminalLiabilityResult(
        List<OffenseProfile> possibleOffenses,
        List<String> possibleDefenses,
        String proceduralRecommendation,
        String disclaimer
) {
    public record OffenseProfile(String offense, String article, List<String> elements, String penalty) {}
}
