package com.gt.wordfilter.util;

import java.util.Locale;

public class WordUtil {

    private WordUtil() { }

    // Trims and lower cases. Returns an empty string for null input.
    public static String normalize(String word) {
        if (word == null) {
            return "";
        }

        return word.strip().toLowerCase(Locale.ROOT);
    }

    // ASCII letters only. The collection and the pattern alphabet are both a-z.
    public static boolean isAlphabetic(String word) {
        if (word == null || word.isEmpty()) {
            return false;
        }

        for (int idx = 0; idx < word.length(); idx++) {
            char c = word.charAt(idx);
            if (!((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'))) {
                return false;
            }
        }

        return true;
    }

    public static double roundTwoDecimals(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
