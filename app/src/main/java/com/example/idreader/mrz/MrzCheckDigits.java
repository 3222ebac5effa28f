package com.example.idreader.mrz;

/**
 * ICAO Doc 9303 check digit calculation (Part 3, section 4.9).
 */
public final class MrzCheckDigits {

    private static final int[] WEIGHTS = {7, 3, 1};

    private MrzCheckDigits() {}

    /**
     * Calculate the check digit for the given fixed-width field.
     *
     * @param data field content, fillers included
     * @return value in {@code 0..9}
     */
    public static int calculate(String data) {
        int sum = 0;

        for (int i = 0; i < data.length(); i++) {
            sum += characterValue(data.charAt(i)) * WEIGHTS[i % WEIGHTS.length];
        }

        return sum % 10;
    }

    /**
     * Same as {@link #calculate(String)}, as the character printed in the MRZ.
     */
    public static char compute(String data) {
        return (char) ('0' + calculate(data));
    }

    /**
     * Verify a printed check digit against the given data.
     * A filler or any other non-digit in the check digit position never verifies.
     */
    public static boolean verify(String data, char checkDigit) {
        return compute(data) == checkDigit;
    }

    private static int characterValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        } else if (c >= 'A' && c <= 'Z') {
            return c - 'A' + 10;
        }
        // '<' and anything the charset check let through
        return 0;
    }
}
