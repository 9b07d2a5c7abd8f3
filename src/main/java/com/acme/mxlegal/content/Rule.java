package com.acme.mxlegal.content;

import com.acme.mxlegal.model.Finding;

public record Rule(String id, KeywordPredicate predicate, Finding finding) {}
