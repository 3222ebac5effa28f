package com.example.idreader.mrz;

import java.util.Locale;

/**
 * Conversions for MRZ {@code YYMMDD} dates.
 */
public final class MrzDates {

    /** Two-digit years above this are 19xx, the rest 20xx. */
    private static final int CENTURY_PIVOT = 50;

    private MrzDates() {}

    /**
     * Formats an MRZ date as {@code YYYY-MM-DD}. Anything that is not six digits comes back unchanged.
     */
    public static String toIsoDate(String yymmdd) {
        if (yymmdd == null || yymmdd.length() != 6 || !isDigits(yymmdd)) {
            return yymmdd;
        }

        int yy = Integer.parseInt(yymmdd.substring(0, 2));
        int fullYear = yy > CENTURY_PIVOT ? 1900 + yy : 2000 + yy;

        return String.format(Locale.ROOT, "%04d-%s-%s", fullYear, yymmdd.substring(2, 4), yymmdd.substring(4, 6));
    }

    private static boolean isDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }
}
