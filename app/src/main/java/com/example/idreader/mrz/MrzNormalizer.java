package com.example.idreader.mrz;

import java.util.Locale;

/**
 * Character-level normalization for MRZ text.
 * The MRZ alphabet is {@code A-Z}, {@code 0-9} and the filler {@code <}.
 */
public final class MrzNormalizer {

    public static final char FILLER = '<';

    private static final boolean[] VALID_MRZ_CHARS = new boolean[128];

    static {
        for (char c = 'A'; c <= 'Z'; c++) VALID_MRZ_CHARS[c] = true;
        for (char c = '0'; c <= '9'; c++) VALID_MRZ_CHARS[c] = true;
        VALID_MRZ_CHARS[FILLER] = true;
    }

    private MrzNormalizer() {}

    /**
     * Normalizes a multi-line MRZ block for the parser: uppercases and strips all whitespace
     * except line breaks. Symbols outside the MRZ alphabet are kept so the charset check can
     * reject them.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String upper = text.toUpperCase(Locale.ROOT);
        StringBuilder result = new StringBuilder(upper.length());

        for (int i = 0; i < upper.length(); i++) {
            char c = upper.charAt(i);
            if (c == '\n') {
                result.append(c);
            } else if (!isBlank(c)) {
                result.append(c);
            }
        }

        return result.toString();
    }

    /**
     * Normalizes a single OCR line: uppercases and keeps only MRZ characters.
     * Whitespace, line breaks and every other symbol are dropped.
     */
    public static String normalizeLine(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String upper = text.toUpperCase(Locale.ROOT);
        StringBuilder result = new StringBuilder(upper.length());

        for (int i = 0; i < upper.length(); i++) {
            char c = upper.charAt(i);
            if (isValidMrzChar(c)) {
                result.append(c);
            }
        }

        return result.toString();
    }

    // covers no-break spaces, which isWhitespace does not
    private static boolean isBlank(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    public static boolean isValidMrzChar(char c) {
        return c < 128 && VALID_MRZ_CHARS[c];
    }

    /**
     * True if every character of the line is in the MRZ alphabet.
     */
    public static boolean isValidMrzLine(String line) {
        for (int i = 0; i < line.length(); i++) {
            if (!isValidMrzChar(line.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
