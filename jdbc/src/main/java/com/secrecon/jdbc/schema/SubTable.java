package com.secrecon.jdbc.schema;

import static com.secrecon.jdbc.schema.ColumnDescriptor.date;
import static com.secrecon.jdbc.schema.ColumnDescriptor.integer;
import static com.secrecon.jdbc.schema.ColumnDescriptor.varchar;

import com.secrecon.model.SubmissionRecord;
import java.util.ArrayList;
import java.util.List;

/** Submission headers from {@code sub.txt}; empty when the dataset has none. */
public final class SubTable {
    public static final String NAME = "sub";

    private static final TableDefinition DEFINITION = createDefinition();

    private SubTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<SubmissionRecord> submissions) {
        List<Object[]> rows = new ArrayList<>(submissions.size());
        for (SubmissionRecord submission : submissions) {
            rows.add(
                    new Object[] {
                        submission.getFilingId(),
                        submission.getCik(),
                        submission.getName(),
                        submission.getSic(),
                        submission.getCountryOfIncorporation(),
                        submission.getForm(),
                        SqlValues.epochDay(submission.getPeriod()),
                        submission.getFiscalYear(),
                        submission.getFiscalPeriod(),
                        SqlValues.epochDay(submission.getFiled())
                    });
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(varchar("adsh", false));
        columns.add(varchar("cik", true));
        columns.add(varchar("name", true));
        columns.add(varchar("sic", true));
        columns.add(varchar("countryinc", true));
        columns.add(varchar("form", true));
        columns.add(date("period"));
        columns.add(integer("fy", true));
        columns.add(varchar("fp", true));
        columns.add(date("filed"));
        return new TableDefinition(NAME, "TABLE", "Submissions", columns);
    }
}
