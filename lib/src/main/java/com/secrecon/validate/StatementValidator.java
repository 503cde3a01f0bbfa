package com.secrecon.validate;

import com.secrecon.assemble.StatementCoverage;
import com.secrecon.assemble.StatementTable;
import com.secrecon.model.PresentationRow;
import com.secrecon.model.StatementRow;
import java.util.List;
import java.util.Objects;

/** Runs every statement-level check over one reconstructed table. */
public final class StatementValidator {
    private final SubtotalRunner subtotals;

    public StatementValidator(SubtotalRunner subtotals) {
        this.subtotals = Objects.requireNonNull(subtotals, "subtotals");
    }

    /**
     * @param table the reconstruction to check
     * @param structure the presentation rows it was built from, in display order; empty when the
     *     table was synthesized or no structure exists
     */
    public StatementDiagnostics validate(StatementTable table, List<PresentationRow> structure) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(structure, "structure");
        List<StatementRow> rows = table.getRows();
        return new StatementDiagnostics(
                table.getStatement(),
                StatementCoverage.of(table.getStatement(), rows),
                StructuralParity.check(structure, rows),
                CandidateDiagnostics.of(rows),
                MissingValues.classify(rows),
                ContextCoherence.check(table.getStatement(), rows),
                subtotals.run(table.getStatement(), rows));
    }
}
