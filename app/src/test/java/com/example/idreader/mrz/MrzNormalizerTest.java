package com.example.idreader.mrz;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Locale;

import org.junit.jupiter.api.Test;

class MrzNormalizerTest {

    @Test
    void normalizeUppercasesAndKeepsLineBreaks() {
        assertEquals("P<UTO\nL898", MrzNormalizer.normalize(" p<u to\r\nl89 8\t"));
    }

    @Test
    void normalizeKeepsForeignSymbolsForTheCharsetCheck() {
        assertEquals("AB#<", MrzNormalizer.normalize("ab #<"));
    }

    @Test
    void normalizeLineDropsEverythingOutsideTheAlphabet() {
        assertEquals("P<UTOERIKSSON<<ANNA", MrzNormalizer.normalizeLine("p<uto eriksson«<<anna!\n"));
    }

    @Test
    void nullAndEmptyNormalizeToEmpty() {
        assertEquals("", MrzNormalizer.normalize(null));
        assertEquals("", MrzNormalizer.normalizeLine(""));
    }

    @Test
    void charsetCheck() {
        assertTrue(MrzNormalizer.isValidMrzLine("L898902C36UTO<<"));
        assertFalse(MrzNormalizer.isValidMrzLine("L898902C36UTO#<"));
        assertFalse(MrzNormalizer.isValidMrzLine("Ä<<"));
    }

    @Test
    void noBreakSpacesAreStripped() {
        assertEquals("L898902C3\nUTO", MrzNormalizer.normalize("L898\u00A0902C3\n\u2007UTO\u202F"));
    }

    @Test
    void uppercasingIgnoresTheDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals("ERIKSSON<<ANNA<MARIA", MrzNormalizer.normalize("eriksson<<anna<maria"));
            assertEquals("ERIKSSON<<ANNA<MARIA", MrzNormalizer.normalizeLine("eriksson<<anna<maria"));
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void lowercaseMrzSurvivesTurkishLocale() throws Exception {
        String l1 = "p<utoeriksson<<anna<maria<<<<<<<<<<<<<<<<<<<";
        String l2 = "l898902c36uto7408122f1204159ze184226b<<<<<10";

        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            MrzResult result = new MrzParser().parseAndValidate(l1 + "\n" + l2);
            assertEquals("ANNA MARIA", result.getGivenNames());
            assertTrue(result.isValid());
        } finally {
            Locale.setDefault(saved);
        }
    }
}
