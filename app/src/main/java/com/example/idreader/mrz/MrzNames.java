package com.example.idreader.mrz;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Decodes the MRZ name field: {@code SURNAME<<GIVEN<NAMES<<<}.
 */
public final class MrzNames {

    private static final String NAME_SEPARATOR = "<<";

    private MrzNames() {}

    /**
     * Splits on the first {@code <<}. Inside each part every run of fillers becomes one space.
     * Without a separator the whole field is the surname.
     */
    public static NameComponents decode(String nameField) {
        if (nameField == null || nameField.isEmpty()) {
            return new NameComponents("", "");
        }

        int separator = nameField.indexOf(NAME_SEPARATOR);
        if (separator < 0) {
            return new NameComponents(joinWords(nameField), "");
        }

        String surname = nameField.substring(0, separator);
        String givenNames = nameField.substring(separator + NAME_SEPARATOR.length());
        return new NameComponents(joinWords(surname), joinWords(givenNames));
    }

    private static String joinWords(String segment) {
        return Arrays.stream(segment.split("<+"))
                .map(String::trim)
                .filter(word -> !word.isEmpty())
                .collect(Collectors.joining(" "));
    }

    /**
     * Name components extracted from MRZ.
     */
    public static class NameComponents {
        public final String surname;
        public final String givenNames;

        public NameComponents(String surname, String givenNames) {
            this.surname = surname;
            this.givenNames = givenNames;
        }

        public String getFullName() {
            if (surname.isEmpty()) {
                return givenNames;
            }
            if (givenNames.isEmpty()) {
                return surname;
            }
            return givenNames + " " + surname;
        }
    }
}
