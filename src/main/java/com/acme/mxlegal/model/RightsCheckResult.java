package com.acme.mxlegal.model;

import java.util.List;

public record RightsCheckResult(
        List<String> violatedRights,
        List<String> constitutionalArticles,
        boolean amparoAvailable,
        String recommendation,
        String disclaimer
) {}
