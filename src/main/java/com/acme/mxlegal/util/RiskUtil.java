package com.acme.mxlegal.util;

import com.acme.mxlegal.model.Enums.RiskLevel;
import com.acme.mxlegal.model.Finding;

import java.util.List;

public final class RiskUtil {
    private RiskUtil() {}

    public static RiskLevel worst(List<Finding> findings) {
        RiskLevel worst = RiskLevel.LOW;
        for (Finding f : findings) {
            if (f.riskLevel() == RiskLevel.HIGH) return RiskLevel.HIGH;
            worst = worst(worst, f.riskLevel());
        }
        return worst;
    }

    public static RiskLevel worst(RiskLevel a, RiskLevel b) {
        if (a == RiskLevel.HIGH || b == RiskLevel.HIGH) return RiskLevel.HIGH;
        if (a == RiskLevel.MEDIUM || b == RiskLevel.MEDIUM) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }

    public static int exitCode(RiskLevel level) {
        return switch (level) {
            case LOW -> 0;
            case MEDIUM -> 1;
            case HIGH -> 2;
        };
    }
}
