package com.kickoff.tipping.util;

import java.util.Locale;

public class TeamNameNormalizer {

    private TeamNameNormalizer() {}

    /** Lowercases and strips everything that is not a letter or digit ("St. George Illawarra" -> "stgeorgeillawarra"). */
    public static String token(String name) {
        if (name == null) return "";
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    /**
     * Cross-source team match: one normalized name contains the other, so the draw page's
     * nickname ("Storm") matches the odds feed's full name ("Melbourne Storm").
     */
    public static boolean matches(String a, String b) {
        String ta = token(a);
        String tb = token(b);
        if (ta.isEmpty() || tb.isEmpty()) return false;
        return ta.contains(tb) || tb.contains(ta);
    }
}
