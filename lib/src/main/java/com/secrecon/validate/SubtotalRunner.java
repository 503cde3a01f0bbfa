package com.secrecon.validate;

import com.secrecon.model.StatementCode;
import com.secrecon.model.StatementRow;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Runs the registered subtotal rules that apply to a statement. */
public final class SubtotalRunner {

    private final List<SubtotalRule> rules;
    private final BigDecimal tolerance;

    public SubtotalRunner(List<SubtotalRule> rules, BigDecimal tolerance) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
        if (tolerance.signum() < 0) {
            throw new IllegalArgumentException("Tolerance must not be negative: " + tolerance);
        }
    }

    /** The balance-sheet equation and the cash roll-forward. */
    public static SubtotalRunner defaultRules(BigDecimal tolerance) {
        return new SubtotalRunner(List.of(new BalanceSheetEquationRule(), new CashRollForwardRule()), tolerance);
    }

    /** Results of every rule applying to the statement, in rule order. */
    public List<SubtotalCheck> run(StatementCode statement, List<StatementRow> rows) {
        List<SubtotalCheck> checks = new ArrayList<>();
        for (SubtotalRule rule : rules) {
            if (rule.appliesTo(statement)) {
                checks.add(rule.evaluate(rows, tolerance));
            }
        }
        return checks;
    }

    public BigDecimal getTolerance() {
        return tolerance;
    }
}
