package com.example.idreader.mrz;

/**
 * Fixed-offset slicing helpers shared by the per-format extractors.
 * Callers pass lines whose length was already validated against the format.
 */
final class MrzFields {

    private MrzFields() {}

    /** Half-open range {@code [start, end)}. */
    static String slice(String line, int start, int end) {
        return line.substring(start, end);
    }

    static char at(String line, int index) {
        return line.charAt(index);
    }

    /** Display form: all fillers removed, surrounding whitespace trimmed. */
    static String unfill(String field) {
        return field.replace(String.valueOf(MrzNormalizer.FILLER), "").trim();
    }
}
