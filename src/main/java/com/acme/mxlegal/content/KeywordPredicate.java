package com.acme.mxlegal.content;

import com.acme.mxlegal.util.TextUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Case- and accent-insensitive presence/absence test over folded text. Keywords match whole
 * words only; a trailing {@code *} marks a stem that also matches longer words ({@code "golpe*"}
 * matches "golpearon").
 * Matches when at least one {@code anyOf} keyword is present (if any are declared), every
 * {@code allOf} keyword is present, and no {@code noneOf} keyword is present.
 */
public final class KeywordPredicate {
    private final List<Pattern> anyOf;
    private final List<Pattern> allOf;
    private final List<Pattern> noneOf;

    private KeywordPredicate(List<Pattern> anyOf, List<Pattern> allOf, List<Pattern> noneOf) {
        if (anyOf.isEmpty() && allOf.isEmpty()) {
            throw new IllegalArgumentException("Predicate needs at least one positive keyword");
        }
        this.anyOf = anyOf;
        this.allOf = allOf;
        this.noneOf = noneOf;
    }

    public static KeywordPredicate anyOf(String... keywords) {
        return new KeywordPredicate(compile(List.of(), keywords), List.of(), List.of());
    }

    public KeywordPredicate and(String... keywords) {
        return new KeywordPredicate(anyOf, compile(allOf, keywords), noneOf);
    }

    public KeywordPredicate unless(String... keywords) {
        return new KeywordPredicate(anyOf, allOf, compile(noneOf, keywords));
    }

    public boolean test(String foldedText) {
        if (!anyOf.isEmpty() && !findsAny(foldedText, anyOf)) return false;
        for (Pattern p : allOf) {
            if (!p.matcher(foldedText).find()) return false;
        }
        return !findsAny(foldedText, noneOf);
    }

    static Pattern keywordPattern(String keyword) {
        String k = TextUtil.fold(keyword).trim();
        boolean stem = k.endsWith("*");
        if (stem) k = k.substring(0, k.length() - 1);
        if (k.isEmpty()) throw new IllegalArgumentException("Blank keyword");
        return Pattern.compile("\\b" + Pattern.quote(k) + (stem ? "" : "\\b"));
    }

    private static boolean findsAny(String text, List<Pattern> patterns) {
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) return true;
        }
        return false;
    }

    private static List<Pattern> compile(List<Pattern> base, String... more) {
        List<Pattern> out = new ArrayList<>(base);
        for (String k : more) out.add(keywordPattern(k));
        return List.copyOf(out);
    }

    @Override
    public String toString() {
        return "KeywordPredicate{anyOf=" + anyOf + ", allOf=" + allOf + ", noneOf=" + noneOf + "}";
    }
}
