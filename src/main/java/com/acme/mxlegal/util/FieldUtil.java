package com.acme.mxlegal.util;

import java.util.*;

public final class FieldUtil {
    private FieldUtil() {}

    public static boolean isPresent(Object value) {
        if (value == null) return false;
        if (value instanceof String s) return !s.isBlank();
        if (value instanceof Collection<?> c) {
            for (Object o : c) if (isPresent(o)) return true;
            return false;
        }
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }

    public static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    public static String asText(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    // Entries are kept as given, blanks included; a list with no content at all is empty.
    public static List<Object> asList(Object value) {
        if (!isPresent(value)) return List.of();
        if (value instanceof Collection<?> c) return new ArrayList<>(c);
        return List.of(value);
    }

    public static boolean hasBlankEntry(Collection<?> c) {
        for (Object o : c) if (!isPresent(o)) return true;
        return false;
    }

    public static List<String> stringList(Object value) {
        if (!(value instanceof Collection<?> c)) return null;
        List<String> out = new ArrayList<>();
        for (Object o : c) {
            if (o != null && !isScalar(o)) return null;
            out.add(o == null ? null : String.valueOf(o));
        }
        return out;
    }
}
