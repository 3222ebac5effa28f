package com.example.idreader.readers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.idreader.detection.ScanResult;
import com.example.idreader.mrz.MrzParser;
import com.example.idreader.mrz.MrzResult;

import org.jmrtd.BACKeySpec;
import org.junit.jupiter.api.Test;

class DocumentAuthDataTest {

    private static final String TD3 = "P<UTOERIKSSON<<ANNA<MARIA<<<<<<<<<<<<<<<<<<<\n"
            + "L898902C36UTO7408122F1204159ZE184226B<<<<<10";
    private static final String TD3_BAD_DOB = "P<UTOERIKSSON<<ANNA<MARIA<<<<<<<<<<<<<<<<<<<\n"
            + "L898902C36UTO7408132F1204159ZE184226B<<<<<10";

    private final MrzParser parser = new MrzParser();

    @Test
    void bacKeyFromValidMrz() throws Exception {
        DocumentAuthData auth = DocumentAuthData.from(parser.parseAndValidate(TD3), null);

        assertTrue(auth.isValid());
        BACKeySpec key = auth.toBacKey();
        assertEquals("L898902C3", key.getDocumentNumber());
        assertEquals("740812", key.getDateOfBirth());
        assertEquals("120415", key.getDateOfExpiry());
        assertEquals("L898902C3674081221204159", auth.getMrzKey());
    }

    @Test
    void invalidMrzHasNoBacKey() throws Exception {
        DocumentAuthData auth = DocumentAuthData.from(parser.parseAndValidate(TD3_BAD_DOB), null);

        assertFalse(auth.isValid());
        assertThrows(IllegalStateException.class, auth::toBacKey);
    }

    @Test
    void canKeyFromScan() throws Exception {
        MrzResult mrz = parser.parseAndValidate(TD3);
        DocumentAuthData auth = DocumentAuthData.from(new ScanResult(TD3, "482391", mrz));

        assertEquals("482391", auth.getCan().get());
        assertNotNull(auth.toCanKey());
    }

    @Test
    void noCanNoCanKey() throws Exception {
        DocumentAuthData auth = DocumentAuthData.from(parser.parseAndValidate(TD3), null);

        assertFalse(auth.getCan().isPresent());
        assertThrows(IllegalStateException.class, auth::toCanKey);
    }

    @Test
    void fieldsComeFromTheParsedMrz() throws Exception {
        DocumentAuthData auth = DocumentAuthData.from(parser.parseAndValidate(TD3), null);

        assertEquals("L898902C3", auth.getDocumentNumber());
        assertEquals("740812", auth.getDateOfBirth());
        assertEquals("120415", auth.getDateOfExpiry());
    }
}
