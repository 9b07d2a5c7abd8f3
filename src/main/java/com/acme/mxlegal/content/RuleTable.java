package com.acme.mxlegal.content;

import com.acme.mxlegal.model.Enums.LegalArea;

import java.util.List;

public record RuleTable(LegalArea area, List<Rule> rules) {
    public RuleTable {
        rules = List.copyOf(rules);
    }
}
