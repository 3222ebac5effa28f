package com.example.idreader.mrz;

import java.util.Objects;

/**
 * Parsed, checksum-annotated MRZ record. Immutable.
 *
 * <p>Dates are kept in their printed {@code YYMMDD} form; see {@link MrzDates} for display.
 * The document number is available both as the display value (fillers removed) and as the
 * raw fixed-width field used for check digits and chip access keys.</p>
 */
public final class MrzResult {

    private final MrzFormat format;
    private final String documentType;
    private final String issuingCountry;
    private final String surnames;
    private final String givenNames;

    private final String documentNumber;
    private final String documentNumberRaw;
    private final char documentNumberCheckDigit;
    private final String nationality;
    private final String birthDate;
    private final char birthDateCheckDigit;
    private final String sex;
    private final String expiryDate;
    private final char expiryDateCheckDigit;
    private final String optionalData;

    private final Checks checks;

    private MrzResult(Builder builder) {
        this.format = Objects.requireNonNull(builder.format, "format");
        this.documentType = builder.documentType;
        this.issuingCountry = builder.issuingCountry;
        this.surnames = builder.surnames;
        this.givenNames = builder.givenNames;
        this.documentNumber = builder.documentNumber;
        this.documentNumberRaw = builder.documentNumberRaw;
        this.documentNumberCheckDigit = builder.documentNumberCheckDigit;
        this.nationality = builder.nationality;
        this.birthDate = builder.birthDate;
        this.birthDateCheckDigit = builder.birthDateCheckDigit;
        this.sex = builder.sex;
        this.expiryDate = builder.expiryDate;
        this.expiryDateCheckDigit = builder.expiryDateCheckDigit;
        this.optionalData = builder.optionalData;
        this.checks = Objects.requireNonNull(builder.checks, "checks");
    }

    public static Builder builder(MrzFormat format) {
        return new Builder(format);
    }

    public MrzFormat getFormat() { return format; }
    public String getDocumentType() { return documentType; }
    public String getIssuingCountry() { return issuingCountry; }
    public String getSurnames() { return surnames; }
    public String getGivenNames() { return givenNames; }
    public String getDocumentNumber() { return documentNumber; }
    public String getDocumentNumberRaw() { return documentNumberRaw; }
    public char getDocumentNumberCheckDigit() { return documentNumberCheckDigit; }
    public String getNationality() { return nationality; }
    public String getBirthDate() { return birthDate; }
    public char getBirthDateCheckDigit() { return birthDateCheckDigit; }
    public String getSex() { return sex; }
    public String getExpiryDate() { return expiryDate; }
    public char getExpiryDateCheckDigit() { return expiryDateCheckDigit; }
    public String getOptionalData() { return optionalData; }
    public Checks getChecks() { return checks; }

    public boolean isValid() {
        return checks.isValid();
    }

    /**
     * Chip access key: raw document number, birth date and expiry date, each followed by its
     * check digit. Always derived from the fields, never stored.
     */
    public String getMrzKey() {
        return documentNumberRaw + documentNumberCheckDigit
                + birthDate + birthDateCheckDigit
                + expiryDate + expiryDateCheckDigit;
    }

    /**
     * TD3 documents, and any document whose type code starts with {@code P}.
     */
    public boolean isPassport() {
        if (format == MrzFormat.TD3) {
            return true;
        }
        return MrzFields.unfill(documentType).startsWith("P");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MrzResult)) return false;
        MrzResult that = (MrzResult) o;
        return documentNumberCheckDigit == that.documentNumberCheckDigit
                && birthDateCheckDigit == that.birthDateCheckDigit
                && expiryDateCheckDigit == that.expiryDateCheckDigit
                && format == that.format
                && Objects.equals(documentType, that.documentType)
                && Objects.equals(issuingCountry, that.issuingCountry)
                && Objects.equals(surnames, that.surnames)
                && Objects.equals(givenNames, that.givenNames)
                && Objects.equals(documentNumber, that.documentNumber)
                && Objects.equals(documentNumberRaw, that.documentNumberRaw)
                && Objects.equals(nationality, that.nationality)
                && Objects.equals(birthDate, that.birthDate)
                && Objects.equals(sex, that.sex)
                && Objects.equals(expiryDate, that.expiryDate)
                && Objects.equals(optionalData, that.optionalData)
                && checks.equals(that.checks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(format, documentType, issuingCountry, surnames, givenNames,
                documentNumber, documentNumberRaw, documentNumberCheckDigit, nationality,
                birthDate, birthDateCheckDigit, sex, expiryDate, expiryDateCheckDigit,
                optionalData, checks);
    }

    @Override
    public String toString() {
        return String.format(
                "MrzResult{format=%s, docType='%s', issuer='%s', docNum='%s', dob='%s', expiry='%s', " +
                        "name='%s %s', valid=%b}",
                format, documentType, issuingCountry, documentNumber, birthDate, expiryDate,
                givenNames, surnames, isValid()
        );
    }

    /**
     * Per-field validation flags.
     */
    public static final class Checks {
        private final boolean lineLengthsOk;
        private final boolean charsetOk;
        private final boolean documentNumberOk;
        private final boolean birthDateOk;
        private final boolean expiryDateOk;
        private final boolean optionalDataOk;
        private final boolean compositeOk;

        public Checks(boolean lineLengthsOk, boolean charsetOk, boolean documentNumberOk,
                      boolean birthDateOk, boolean expiryDateOk, boolean optionalDataOk,
                      boolean compositeOk) {
            this.lineLengthsOk = lineLengthsOk;
            this.charsetOk = charsetOk;
            this.documentNumberOk = documentNumberOk;
            this.birthDateOk = birthDateOk;
            this.expiryDateOk = expiryDateOk;
            this.optionalDataOk = optionalDataOk;
            this.compositeOk = compositeOk;
        }

        public boolean isLineLengthsOk() { return lineLengthsOk; }
        public boolean isCharsetOk() { return charsetOk; }
        public boolean isDocumentNumberOk() { return documentNumberOk; }
        public boolean isBirthDateOk() { return birthDateOk; }
        public boolean isExpiryDateOk() { return expiryDateOk; }
        public boolean isOptionalDataOk() { return optionalDataOk; }
        public boolean isCompositeOk() { return compositeOk; }

        /**
         * Structure plus the three primary check digits. Optional data and composite digits
         * are informational and do not take part, for any format.
         */
        public boolean isValid() {
            return lineLengthsOk && charsetOk
                    && documentNumberOk && birthDateOk && expiryDateOk;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Checks)) return false;
            Checks that = (Checks) o;
            return lineLengthsOk == that.lineLengthsOk
                    && charsetOk == that.charsetOk
                    && documentNumberOk == that.documentNumberOk
                    && birthDateOk == that.birthDateOk
                    && expiryDateOk == that.expiryDateOk
                    && optionalDataOk == that.optionalDataOk
                    && compositeOk == that.compositeOk;
        }

        @Override
        public int hashCode() {
            return Objects.hash(lineLengthsOk, charsetOk, documentNumberOk, birthDateOk,
                    expiryDateOk, optionalDataOk, compositeOk);
        }

        @Override
        public String toString() {
            return String.format(
                    "Checks{docNum=%b, dob=%b, expiry=%b, optional=%b, composite=%b}",
                    documentNumberOk, birthDateOk, expiryDateOk, optionalDataOk, compositeOk
            );
        }
    }

    public static final class Builder {
        private final MrzFormat format;
        private String documentType;
        private String issuingCountry;
        private String surnames;
        private String givenNames;
        private String documentNumber;
        private String documentNumberRaw;
        private char documentNumberCheckDigit;
        private String nationality;
        private String birthDate;
        private char birthDateCheckDigit;
        private String sex;
        private String expiryDate;
        private char expiryDateCheckDigit;
        private String optionalData;
        private Checks checks;

        private Builder(MrzFormat format) {
            this.format = format;
        }

        public Builder documentType(String documentType) {
            this.documentType = documentType;
            return this;
        }

        public Builder issuingCountry(String issuingCountry) {
            this.issuingCountry = issuingCountry;
            return this;
        }

        public Builder names(MrzNames.NameComponents names) {
            this.surnames = names.surname;
            this.givenNames = names.givenNames;
            return this;
        }

        /** Sets the raw field and derives the display value from it. */
        public Builder documentNumber(String raw, char checkDigit) {
            this.documentNumberRaw = raw;
            this.documentNumber = MrzFields.unfill(raw);
            this.documentNumberCheckDigit = checkDigit;
            return this;
        }

        public Builder nationality(String nationality) {
            this.nationality = nationality;
            return this;
        }

        public Builder birthDate(String yymmdd, char checkDigit) {
            this.birthDate = yymmdd;
            this.birthDateCheckDigit = checkDigit;
            return this;
        }

        public Builder sex(String sex) {
            this.sex = sex;
            return this;
        }

        public Builder expiryDate(String yymmdd, char checkDigit) {
            this.expiryDate = yymmdd;
            this.expiryDateCheckDigit = checkDigit;
            return this;
        }

        /** Raw optional data; stored without fillers. */
        public Builder optionalData(String raw) {
            this.optionalData = MrzFields.unfill(raw);
            return this;
        }

        public Builder checks(Checks checks) {
            this.checks = checks;
            return this;
        }

        public MrzResult build() {
            return new MrzResult(this);
        }
    }
}
