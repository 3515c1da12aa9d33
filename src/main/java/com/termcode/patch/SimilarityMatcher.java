package com.termcode.patch;

/**
 * Normalized Levenshtein similarity between two lines.
 */
public final class SimilarityMatcher {

    private SimilarityMatcher() {
    }

    /**
     * {@code 1 - editDistance / max(length)}, in [0, 1]. Two empty strings are identical.
     */
    public static double similarity(String expected, String actual) {
        String a = expected != null ? expected : "";
        String b = actual != null ? actual : "";
        int maxLength = Math.max(a.length(), b.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return (double) (maxLength - editDistance(a, b)) / maxLength;
    }

    public static int editDistance(String a, String b) {
        if (a.equals(b)) {
            return 0;
        }
        if (a.isEmpty()) {
            return b.length();
        }
        if (b.isEmpty()) {
            return a.length();
        }

        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                    Math.min(current[j - 1] + 1, previous[j] + 1),
                    previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
