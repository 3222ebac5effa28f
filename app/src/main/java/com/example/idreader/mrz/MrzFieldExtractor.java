package com.example.idreader.mrz;

import java.util.List;

/**
 * Fixed-offset field extraction for one MRZ format.
 */
public interface MrzFieldExtractor {

    /**
     * Extract all fields and check digit results.
     * Never fails: the lines have already been validated for shape and charset.
     *
     * @param lines the MRZ lines, in document order
     */
    MrzResult extract(List<String> lines);
}
