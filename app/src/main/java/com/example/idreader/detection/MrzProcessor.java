package com.example.idreader.detection;

import com.example.idreader.mrz.MrzParseException;
import com.example.idreader.mrz.MrzParser;
import com.example.idreader.mrz.MrzResult;
import com.example.idreader.ocr.CanExtractor;
import com.example.idreader.ocr.MrzCandidateExtractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Turns one frame's OCR lines into a scan result. Stateless; de-duplication is the caller's job.
 */
public class MrzProcessor {
    private static final Logger log = LoggerFactory.getLogger(MrzProcessor.class);

    private final MrzParser parser;
    private final MrzCandidateExtractor candidateExtractor;
    private final CanExtractor canExtractor;

    public MrzProcessor() {
        this(new MrzParser(), new MrzCandidateExtractor(), new CanExtractor());
    }

    public MrzProcessor(MrzParser parser, MrzCandidateExtractor candidateExtractor,
                        CanExtractor canExtractor) {
        this.parser = parser;
        this.candidateExtractor = candidateExtractor;
        this.canExtractor = canExtractor;
    }

    /**
     * @param lines OCR texts that passed the confidence floor
     * @return a result if the frame holds a structurally valid MRZ, otherwise empty
     */
    public Optional<ScanResult> process(List<String> lines) {
        Optional<String> candidate = candidateExtractor.extractMrzCandidate(lines);
        if (candidate.isEmpty()) {
            return Optional.empty();
        }

        String mrzText = candidate.get();
        String can = canExtractor.extractCan(lines).orElse(null);

        try {
            MrzResult result = parser.parseAndValidate(mrzText);
            log.debug("Parsed candidate: {}", result);
            return Optional.of(new ScanResult(mrzText, can, result));
        } catch (MrzParseException e) {
            log.debug("Candidate rejected ({}): {}", e.getReason(), e.getMessage());
            return Optional.empty();
        }
    }
}
