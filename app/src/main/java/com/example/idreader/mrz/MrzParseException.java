package com.example.idreader.mrz;

/**
 * Thrown when a text block is structurally not an MRZ.
 * Check digit mismatches are never reported this way, see {@link MrzResult.Checks}.
 */
public class MrzParseException extends Exception {

    public enum Reason {
        /** Fewer than 2 non-empty lines. */
        NOT_ENOUGH_LINES,
        /** Line count and lengths match none of TD1, TD2 or TD3. */
        WRONG_LENGTH,
        /** A line contains a character outside {@code A-Z 0-9 <}. */
        INVALID_CHARSET
    }

    private final Reason reason;

    public MrzParseException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
