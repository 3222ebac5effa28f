package com.example.idreader.mrz;

import static com.example.idreader.mrz.MrzFields.at;
import static com.example.idreader.mrz.MrzFields.slice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * TD3 (passport booklet), 2 lines of 44.
 */
public class Td3PassportExtractor implements MrzFieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(Td3PassportExtractor.class);

    private static final int NAME_FIELD_LENGTH = 39;

    @Override
    public MrzResult extract(List<String> lines) {
        String l1 = lines.get(0);
        String l2 = lines.get(1);

        // Line 1:
        //   0-1   Document type
        //   2-4   Issuing state
        //   5-43  Name field
        // Line 2:
        //   0-8   Document number,  9 check digit
        //   10-12 Nationality
        //   13-18 Date of birth,   19 check digit
        //   20    Sex
        //   21-26 Expiry date,     27 check digit
        //   28-41 Personal number, 42 check digit
        //   43    Composite check digit
        String nameField = l1.substring(l1.length() - NAME_FIELD_LENGTH);

        String docNum = slice(l2, 0, 9);
        char docNumCheck = at(l2, 9);
        String dob = slice(l2, 13, 19);
        char dobCheck = at(l2, 19);
        String expiry = slice(l2, 21, 27);
        char expiryCheck = at(l2, 27);
        String personalNumber = slice(l2, 28, 42);
        char personalNumberCheck = at(l2, 42);
        char compositeCheck = at(l2, 43);

        log.debug("TD3: Parsing - DocNum: {}, DOB: {}, Expiry: {}", docNum, dob, expiry);

        boolean docNumOk = MrzCheckDigits.verify(docNum, docNumCheck);
        boolean dobOk = MrzCheckDigits.verify(dob, dobCheck);
        boolean expiryOk = MrzCheckDigits.verify(expiry, expiryCheck);
        boolean personalNumberOk = MrzCheckDigits.verify(personalNumber, personalNumberCheck);

        String compositeData = slice(l2, 0, 10) + slice(l2, 13, 20) + slice(l2, 21, 43);
        boolean compositeOk = MrzCheckDigits.verify(compositeData, compositeCheck);

        if (!compositeOk) {
            log.debug("TD3: Invalid composite check digit");
        }

        return MrzResult.builder(MrzFormat.TD3)
                .documentType(slice(l1, 0, 2))
                .issuingCountry(slice(l1, 2, 5))
                .names(MrzNames.decode(nameField))
                .documentNumber(docNum, docNumCheck)
                .nationality(slice(l2, 10, 13))
                .birthDate(dob, dobCheck)
                .sex(String.valueOf(at(l2, 20)))
                .expiryDate(expiry, expiryCheck)
                .optionalData(personalNumber)
                .checks(new MrzResult.Checks(true, true,
                        docNumOk, dobOk, expiryOk, personalNumberOk, compositeOk))
                .build();
    }
}
