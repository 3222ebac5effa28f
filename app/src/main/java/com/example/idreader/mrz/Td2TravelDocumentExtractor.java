package com.example.idreader.mrz;

import static com.example.idreader.mrz.MrzFields.at;
import static com.example.idreader.mrz.MrzFields.slice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * TD2 (ID-2 travel document), 2 lines of 36.
 * Line 2 matches TD3 up to the expiry date; the optional data has no check digit of its own.
 */
public class Td2TravelDocumentExtractor implements MrzFieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(Td2TravelDocumentExtractor.class);

    private static final int NAME_FIELD_LENGTH = 31;

    @Override
    public MrzResult extract(List<String> lines) {
        String l1 = lines.get(0);
        String l2 = lines.get(1);

        String nameField = l1.substring(l1.length() - NAME_FIELD_LENGTH);

        String docNum = slice(l2, 0, 9);
        char docNumCheck = at(l2, 9);
        String dob = slice(l2, 13, 19);
        char dobCheck = at(l2, 19);
        String expiry = slice(l2, 21, 27);
        char expiryCheck = at(l2, 27);
        String optional = slice(l2, 28, 35);
        char compositeCheck = at(l2, 35);

        log.debug("TD2: Parsing - DocNum: {}, DOB: {}, Expiry: {}", docNum, dob, expiry);

        String compositeData = slice(l2, 0, 10) + slice(l2, 13, 20) + slice(l2, 21, 35);

        return MrzResult.builder(MrzFormat.TD2)
                .documentType(slice(l1, 0, 2))
                .issuingCountry(slice(l1, 2, 5))
                .names(MrzNames.decode(nameField))
                .documentNumber(docNum, docNumCheck)
                .nationality(slice(l2, 10, 13))
                .birthDate(dob, dobCheck)
                .sex(String.valueOf(at(l2, 20)))
                .expiryDate(expiry, expiryCheck)
                .optionalData(optional)
                .checks(new MrzResult.Checks(true, true,
                        MrzCheckDigits.verify(docNum, docNumCheck),
                        MrzCheckDigits.verify(dob, dobCheck),
                        MrzCheckDigits.verify(expiry, expiryCheck),
                        true,
                        MrzCheckDigits.verify(compositeData, compositeCheck)))
                .build();
    }
}
