package com.example.idreader.detection;

import com.example.idreader.mrz.MrzResult;

import java.util.Objects;
import java.util.Optional;

/**
 * One accepted scan: the assembled MRZ text, the CAN if one was seen, and the parsed record.
 */
public final class ScanResult {
    private final String mrzText;
    private final String can;
    private final MrzResult mrzResult;

    public ScanResult(String mrzText, String can, MrzResult mrzResult) {
        this.mrzText = Objects.requireNonNull(mrzText, "mrzText");
        this.can = can;
        this.mrzResult = Objects.requireNonNull(mrzResult, "mrzResult");
    }

    public String getMrzText() {
        return mrzText;
    }

    public Optional<String> getCan() {
        return Optional.ofNullable(can);
    }

    public MrzResult getMrzResult() {
        return mrzResult;
    }

    /**
     * Same MRZ text and same CAN; the identity used for de-duplication.
     */
    public boolean isSameScan(ScanResult other) {
        return other != null
                && mrzText.equals(other.mrzText)
                && Objects.equals(can, other.can);
    }

    @Override
    public String toString() {
        return "ScanResult{" + mrzResult + ", can=" + (can != null ? "present" : "none") + "}";
    }
}
