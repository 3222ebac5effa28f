package com.example.idreader.mrz;

import java.util.List;
import java.util.Optional;

/**
 * ICAO 9303 MRZ layouts. The shape (line count and line length) alone identifies the format.
 */
public enum MrzFormat {
    /** ID-1 card: 3 lines of 30. */
    TD1(3, 30),
    /** ID-2 travel document: 2 lines of 36. */
    TD2(2, 36),
    /** Passport booklet: 2 lines of 44. */
    TD3(2, 44);

    private final int lineCount;
    private final int lineLength;

    MrzFormat(int lineCount, int lineLength) {
        this.lineCount = lineCount;
        this.lineLength = lineLength;
    }

    public int getLineCount() {
        return lineCount;
    }

    public int getLineLength() {
        return lineLength;
    }

    /**
     * Whether the given lines have exactly this format's shape.
     */
    public boolean matches(List<String> lines) {
        if (lines.size() != lineCount) {
            return false;
        }
        for (String line : lines) {
            if (line.length() != lineLength) {
                return false;
            }
        }
        return true;
    }

    /**
     * Look up the format whose shape matches the lines exactly.
     */
    public static Optional<MrzFormat> forShape(List<String> lines) {
        for (MrzFormat format : values()) {
            if (format.matches(lines)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
