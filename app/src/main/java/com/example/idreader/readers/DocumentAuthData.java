package com.example.idreader.readers;

import com.example.idreader.detection.ScanResult;
import com.example.idreader.mrz.MrzResult;

import org.jmrtd.BACKey;
import org.jmrtd.BACKeySpec;
import org.jmrtd.PACEKeySpec;

import java.util.Objects;
import java.util.Optional;

/**
 * Authentication data the chip reader needs to open a document.
 * Everything is read through the parsed MRZ; nothing is copied out of it.
 */
public class DocumentAuthData {

    private final MrzResult mrz;
    private final String can; // Card Access Number

    private DocumentAuthData(MrzResult mrz, String can) {
        this.mrz = Objects.requireNonNull(mrz, "mrz");
        this.can = can;
    }

    public static DocumentAuthData from(MrzResult mrz, String can) {
        return new DocumentAuthData(mrz, can);
    }

    public static DocumentAuthData from(ScanResult scan) {
        return new DocumentAuthData(scan.getMrzResult(), scan.getCan().orElse(null));
    }

    /** Raw 9-character field, fillers included. */
    public String getDocumentNumber() { return mrz.getDocumentNumberRaw(); }

    public String getDateOfBirth() { return mrz.getBirthDate(); }

    public String getDateOfExpiry() { return mrz.getExpiryDate(); }

    public Optional<String> getCan() { return Optional.ofNullable(can); }

    /**
     * Opaque BAC/PACE key string: document number, birth date and expiry date with their check digits.
     */
    public String getMrzKey() {
        return mrz.getMrzKey();
    }

    public boolean isValid() {
        return mrz.isValid() && !mrz.getDocumentNumber().isEmpty();
    }

    /**
     * BAC key from the MRZ fields.
     *
     * @throws IllegalStateException if the MRZ failed validation
     */
    public BACKeySpec toBacKey() {
        if (!isValid()) {
            throw new IllegalStateException("MRZ did not validate, cannot derive an access key");
        }
        return new BACKey(getDocumentNumber(), getDateOfBirth(), getDateOfExpiry());
    }

    /**
     * PACE key from the Card Access Number.
     *
     * @throws IllegalStateException if no CAN was scanned
     */
    public PACEKeySpec toCanKey() {
        if (can == null) {
            throw new IllegalStateException("No Card Access Number available");
        }
        return PACEKeySpec.createCANKey(can);
    }
}
