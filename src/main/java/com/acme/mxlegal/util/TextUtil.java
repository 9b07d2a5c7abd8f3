package com.acme.mxlegal.util;

import java.text.Normalizer;
import java.util.*;
import java.util.regex.Pattern;

public final class TextUtil {
    private TextUtil() {}

    private static final Pattern MARKS = Pattern.compile("\\p{M}+");

    /** Lower-cases and strips diacritics so "Despidió" and "despidio" compare equal. */
    public static String fold(String s) {
        if (s == null) return "";
        String decomposed = Normalizer.normalize(s, Normalizer.Form.NFD);
        return MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
    }

    public static List<String> normalizeFacts(List<String> facts) {
        List<String> out = new ArrayList<>();
        if (facts == null) return out;
        for (String f : facts) {
            if (f == null) continue;
            String t = f.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    public static String haystack(List<String> facts, String question) {
        StringJoiner sj = new StringJoiner("\n");
        for (String f : facts) sj.add(fold(f));
        if (question != null && !question.isBlank()) sj.add(fold(question));
        return sj.toString();
    }
}
