package com.team.testcaseimport.util;

import java.util.Locale;

/**
 * String helpers for comparing CSV headers with field names.
 */
public final class HeaderNormalizer {

    private HeaderNormalizer() {
    }

    /**
     * Lowercase and strip everything except letters and digits.
     * "Test Case ID" and "test_case_id" both become "testcaseid".
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "");
    }

    public static String singularize(String value) {
        if (value.endsWith("ies")) {
            return value.substring(0, value.length() - 3) + "y";
        }
        if (value.endsWith("s")) {
            return value.substring(0, value.length() - 1);
        }
        return value;
    }

    /**
     * Reference name tail, e.g. "Priority" for "Microsoft.VSTS.Common.Priority".
     */
    public static String referenceTail(String referenceName) {
        int dot = referenceName.lastIndexOf('.');
        return dot >= 0 ? referenceName.substring(dot + 1) : referenceName;
    }

    /**
     * Levenshtein edit distance. Headers are short, so the full matrix is fine.
     */
    public static int editDistance(String a, String b) {
        if (a.equals(b)) {
            return 0;
        }
        int[][] dp = new int[a.length() + 1][b.length() + 1];
        for (int i = 0; i <= a.length(); i++) {
            dp[i][0] = i;
        }
        for (int j = 0; j <= b.length(); j++) {
            dp[0][j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                dp[i][j] = Math.min(Math.min(dp[i - 1][j] + 1, dp[i][j - 1] + 1), dp[i - 1][j - 1] + cost);
            }
        }
        return dp[a.length()][b.length()];
    }
}
