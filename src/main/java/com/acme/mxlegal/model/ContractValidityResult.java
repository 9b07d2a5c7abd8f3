package com.acme.mxlegal.model;

import java.util.List;
import java.util.Map;

public record ContractValidityResult(
        boolean valid,
        Map<String, Boolean> requirements,
        List<String> issues,
        List<String> applicableArticles,
        List<String> recommendations,
        String disclaimer
) {}
