package com.secrecon.testing;

import com.secrecon.model.NumericFact;
import com.secrecon.model.PresentationRow;
import com.secrecon.model.StatementCode;
import com.secrecon.model.StatementRow;
import java.math.BigDecimal;
import java.time.LocalDate;

/** Small factories for in-code facts and presentation rows. */
public final class Fixtures {
    public static final String FILING = "0000000099-24-000099";
    public static final String VERSION = "us-gaap/2024";

    private Fixtures() {}

    public static NumericFact fact(String tag, String date, Integer quarters, String value) {
        return fact(tag, date, quarters, value, null, null);
    }

    public static NumericFact fact(
            String tag, String date, Integer quarters, String value, String coreg, String segments) {
        return new NumericFact(
                FILING,
                tag,
                VERSION,
                date == null ? null : LocalDate.parse(date),
                quarters,
                "USD",
                coreg,
                segments,
                value == null ? null : new BigDecimal(value));
    }

    public static PresentationRow row(StatementCode statement, int line, String tag, String label) {
        return row(statement, line, tag, label, false);
    }

    public static PresentationRow row(StatementCode statement, int line, String tag, String label, boolean negating) {
        return new PresentationRow(FILING, statement, 1, line, 0, "H", tag, VERSION, label, negating);
    }

    /** A reconstructed row holding {@code value} at the given context, with one agreeing candidate. */
    public static StatementRow valued(PresentationRow row, String value, String date, Integer quarters) {
        return valued(row, value, date, quarters, value == null ? 0 : 1, value == null ? 0 : 1);
    }

    public static StatementRow valued(
            PresentationRow row, String value, String date, Integer quarters, int candidates, int uniqueValues) {
        BigDecimal raw = value == null ? null : new BigDecimal(value);
        return new StatementRow(
                row,
                raw,
                raw,
                null,
                raw == null ? null : "USD",
                date == null ? null : LocalDate.parse(date),
                quarters,
                null,
                null,
                candidates,
                uniqueValues);
    }

    public static BigDecimal dec(String value) {
        return new BigDecimal(value);
    }
}
