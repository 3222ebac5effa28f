package com.example.idreader.ocr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the 6-digit Card Access Number printed outside the MRZ.
 */
public class CanExtractor {
    private static final Logger log = LoggerFactory.getLogger(CanExtractor.class);

    static final int CAN_LENGTH = 6;

    private static final String[] LABEL_HINTS = {"CAN", "CARD", "ACCESS"};

    /**
     * Labeled lines ("CAN", "CARD", "ACCESS") are searched first, then every line.
     * Lines containing {@code '<'} belong to the MRZ and are never searched.
     *
     * @return the first maximal run of exactly six digits, or empty
     */
    public Optional<String> extractCan(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return Optional.empty();
        }

        List<String> eligible = new ArrayList<>();
        for (String line : lines) {
            if (line != null && line.indexOf('<') < 0) {
                eligible.add(line);
            }
        }

        for (String line : eligible) {
            if (hasLabel(line)) {
                Optional<String> can = firstCanRun(line);
                if (can.isPresent()) {
                    log.debug("CAN found on labeled line");
                    return can;
                }
            }
        }

        for (String line : eligible) {
            Optional<String> can = firstCanRun(line);
            if (can.isPresent()) {
                return can;
            }
        }

        return Optional.empty();
    }

    private static boolean hasLabel(String line) {
        String upper = line.toUpperCase(Locale.ROOT);
        for (String hint : LABEL_HINTS) {
            if (upper.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static Optional<String> firstCanRun(String line) {
        for (String run : digitRuns(line)) {
            if (run.length() == CAN_LENGTH) {
                return Optional.of(run);
            }
        }
        return Optional.empty();
    }

    static List<String> digitRuns(String s) {
        List<String> runs = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= '0' && c <= '9') {
                current.append(c);
            } else if (current.length() > 0) {
                runs.add(current.toString());
                current.setLength(0);
            }
        }

        if (current.length() > 0) {
            runs.add(current.toString());
        }

        return runs;
    }
}
