package com.secrecon.model;

import java.time.LocalDate;
import java.util.Objects;

/** One filing from the submission index ({@code sub.txt}). */
public final class SubmissionRecord {
    private final String filingId;
    private final String cik;
    private final String name;
    private final String sic;
    private final String form;
    private final LocalDate period;
    private final Integer fiscalYear;
    private final String fiscalPeriod;
    private final LocalDate filed;
    private final String countryOfIncorporation;

    public SubmissionRecord(
            String filingId,
            String cik,
            String name,
            String sic,
            String form,
            LocalDate period,
            Integer fiscalYear,
            String fiscalPeriod,
            LocalDate filed,
            String countryOfIncorporation) {
        this.filingId = Objects.requireNonNull(filingId, "filingId");
        this.cik = cik;
        this.name = name;
        this.sic = sic;
        this.form = form;
        this.period = period;
        this.fiscalYear = fiscalYear;
        this.fiscalPeriod = fiscalPeriod;
        this.filed = filed;
        this.countryOfIncorporation = countryOfIncorporation;
    }

    public String getFilingId() {
        return filingId;
    }

    public String getCik() {
        return cik;
    }

    public String getName() {
        return name;
    }

    public String getSic() {
        return sic;
    }

    public String getForm() {
        return form;
    }

    public LocalDate getPeriod() {
        return period;
    }

    public Integer getFiscalYear() {
        return fiscalYear;
    }

    public String getFiscalPeriod() {
        return fiscalPeriod;
    }

    public LocalDate getFiled() {
        return filed;
    }

    public String getCountryOfIncorporation() {
        return countryOfIncorporation;
    }
}
