package com.example.idreader.mrz;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for validating an assembled MRZ block.
 * Thread-safe: holds no state besides the immutable extractor table.
 */
public class MrzParser {
    private static final Logger log = LoggerFactory.getLogger(MrzParser.class);

    private final Map<MrzFormat, MrzFieldExtractor> extractors;

    public MrzParser() {
        Map<MrzFormat, MrzFieldExtractor> table = new EnumMap<>(MrzFormat.class);
        table.put(MrzFormat.TD1, new Td1IdCardExtractor());
        table.put(MrzFormat.TD2, new Td2TravelDocumentExtractor());
        table.put(MrzFormat.TD3, new Td3PassportExtractor());
        this.extractors = Collections.unmodifiableMap(table);
    }

    /**
     * Normalize, detect the format, extract fields and verify check digits.
     *
     * @param rawText 2 or 3 newline-delimited MRZ lines; other whitespace is ignored
     * @return the parsed record; check digit failures are reported in its {@link MrzResult.Checks}
     * @throws MrzParseException if the text is structurally not an MRZ
     */
    public MrzResult parseAndValidate(String rawText) throws MrzParseException {
        List<String> lines = splitLines(MrzNormalizer.normalize(rawText));

        MrzFormat format = detectFormat(lines);

        for (String line : lines) {
            if (!MrzNormalizer.isValidMrzLine(line)) {
                throw new MrzParseException(MrzParseException.Reason.INVALID_CHARSET,
                        "Line contains characters outside A-Z 0-9 <");
            }
        }

        log.debug("Detected {} MRZ", format);
        return extractors.get(format).extract(lines);
    }

    /**
     * Decide the format from line count and exact line lengths only.
     */
    MrzFormat detectFormat(List<String> lines) throws MrzParseException {
        if (lines.size() < 2) {
            throw new MrzParseException(MrzParseException.Reason.NOT_ENOUGH_LINES,
                    "Expected 2 or 3 MRZ lines, got " + lines.size());
        }

        return MrzFormat.forShape(lines).orElseThrow(() -> {
            log.debug("No MRZ format matches {} lines of lengths {}", lines.size(), lengths(lines));
            return new MrzParseException(MrzParseException.Reason.WRONG_LENGTH,
                    "No MRZ format has " + lines.size() + " lines of lengths " + lengths(lines));
        });
    }

    private static List<String> splitLines(String normalized) {
        List<String> lines = new ArrayList<>();
        for (String line : normalized.split("\n")) {
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }
        return lines;
    }

    private static List<Integer> lengths(List<String> lines) {
        List<Integer> lengths = new ArrayList<>(lines.size());
        for (String line : lines) {
            lengths.add(line.length());
        }
        return lengths;
    }
}
