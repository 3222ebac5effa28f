package com.example.idreader.ocr;

import com.example.idreader.mrz.MrzNormalizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Picks the most MRZ-like lines out of one frame's OCR output and assembles them into a
 * 2 or 3 line block for the parser.
 *
 * <p>Lines are ranked by fill density ({@code '<'} count) and length, not by their position
 * on the document, so the assembled order is the ranking order. There is no length correction:
 * a line that OCR shortened by a character will simply fail format detection later.</p>
 */
public class MrzCandidateExtractor {
    private static final Logger log = LoggerFactory.getLogger(MrzCandidateExtractor.class);

    static final int MIN_MRZ_LINE_LENGTH = 25;
    static final int TD1_MAX_LINE_LENGTH = 35;
    static final int TWO_LINE_MIN_LENGTH = 30;

    private static final String FILL_PATTERN = "<<";

    /**
     * Assemble an MRZ candidate from the frame's lines.
     *
     * @param lines raw OCR texts, in any order
     * @return lines joined by {@code '\n'}, or empty when the frame has no usable MRZ
     */
    public Optional<String> extractMrzCandidate(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return Optional.empty();
        }

        List<CandidateLine> mrzLike = new ArrayList<>();
        for (String line : lines) {
            String normalized = MrzNormalizer.normalizeLine(line);
            if (normalized.length() >= MIN_MRZ_LINE_LENGTH && normalized.contains(FILL_PATTERN)) {
                mrzLike.add(new CandidateLine(normalized));
            }
        }

        if (mrzLike.isEmpty()) {
            return Optional.empty();
        }

        log.debug("{} MRZ-like lines out of {}", mrzLike.size(), lines.size());

        // TD1: three lines of about 30
        List<CandidateLine> td1 = mrzLike.stream()
                .filter(c -> c.text.length() <= TD1_MAX_LINE_LENGTH)
                .collect(Collectors.toList());
        if (td1.size() >= 3) {
            List<CandidateLine> top = rank(td1, 3);
            if (allAtLeast(top, MIN_MRZ_LINE_LENGTH)) {
                return Optional.of(join(top));
            }
        }

        // TD2 / TD3: two lines
        if (mrzLike.size() >= 2) {
            List<CandidateLine> top = rank(mrzLike, 2);
            if (allAtLeast(top, TWO_LINE_MIN_LENGTH)) {
                return Optional.of(join(top));
            }
        }

        return Optional.empty();
    }

    /** Stable: equal scores keep input order. */
    private static List<CandidateLine> rank(List<CandidateLine> candidates, int limit) {
        return candidates.stream()
                .sorted(Comparator.comparingInt((CandidateLine c) -> c.score).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    private static boolean allAtLeast(List<CandidateLine> candidates, int minLength) {
        for (CandidateLine candidate : candidates) {
            if (candidate.text.length() < minLength) {
                return false;
            }
        }
        return true;
    }

    private static String join(List<CandidateLine> candidates) {
        return candidates.stream()
                .map(c -> c.text)
                .collect(Collectors.joining("\n"));
    }

    static int score(String line) {
        int fillers = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == MrzNormalizer.FILLER) {
                fillers++;
            }
        }
        return fillers * 10 + line.length();
    }

    private static class CandidateLine {
        final String text;
        final int score;

        CandidateLine(String text) {
            this.text = text;
            this.score = score(text);
        }
    }
}
