package com.example.idreader.mrz;

import static com.example.idreader.mrz.MrzFields.at;
import static com.example.idreader.mrz.MrzFields.slice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * TD1 (ID-1 card), 3 lines of 30.
 */
public class Td1IdCardExtractor implements MrzFieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(Td1IdCardExtractor.class);

    @Override
    public MrzResult extract(List<String> lines) {
        String l1 = lines.get(0);
        String l2 = lines.get(1);
        String l3 = lines.get(2);

        // Line 1:
        //   0-1   Document type
        //   2-4   Issuing state
        //   5-13  Document number, 14 check digit
        //   15-29 Optional data 1
        // Line 2:
        //   0-5   Date of birth,   6 check digit
        //   7     Sex
        //   8-13  Expiry date,     14 check digit
        //   15-17 Nationality
        //   18-28 Optional data 2
        //   29    Composite check digit
        // Line 3: name field
        String docNum = slice(l1, 5, 14);
        char docNumCheck = at(l1, 14);
        String optional1 = slice(l1, 15, 30);

        String dob = slice(l2, 0, 6);
        char dobCheck = at(l2, 6);
        String expiry = slice(l2, 8, 14);
        char expiryCheck = at(l2, 14);
        String optional2 = slice(l2, 18, 29);
        char compositeCheck = at(l2, 29);

        log.debug("TD1: Parsing - DocNum: {}, DOB: {}, Expiry: {}", docNum, dob, expiry);

        String compositeData = slice(l1, 5, 30) + slice(l2, 0, 7) + slice(l2, 8, 15) + optional2;

        return MrzResult.builder(MrzFormat.TD1)
                .documentType(slice(l1, 0, 2))
                .issuingCountry(slice(l1, 2, 5))
                .names(MrzNames.decode(l3))
                .documentNumber(docNum, docNumCheck)
                .nationality(slice(l2, 15, 18))
                .birthDate(dob, dobCheck)
                .sex(String.valueOf(at(l2, 7)))
                .expiryDate(expiry, expiryCheck)
                .optionalData(optional1 + optional2)
                .checks(new MrzResult.Checks(true, true,
                        MrzCheckDigits.verify(docNum, docNumCheck),
                        MrzCheckDigits.verify(dob, dobCheck),
                        MrzCheckDigits.verify(expiry, expiryCheck),
                        true,
                        MrzCheckDigits.verify(compositeData, compositeCheck)))
                .build();
    }
}
