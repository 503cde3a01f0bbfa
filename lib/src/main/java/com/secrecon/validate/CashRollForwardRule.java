package com.secrecon.validate;

import com.secrecon.model.StatementCode;
import com.secrecon.model.StatementRow;
import com.secrecon.semantic.ConceptRole;
import com.secrecon.semantic.SemanticRules;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The net change in cash, with or without the exchange-rate effect, must equal ending cash minus
 * beginning cash.
 */
final class CashRollForwardRule implements SubtotalRule {
    static final String NAME = "cash_roll_forward";
    static final String NET_CHANGE = "net_change";
    static final String NET_CHANGE_PLUS_FX = "net_change_plus_fx";

    private static final List<String> NET_CHANGE_TAGS =
            List.of(
                    "CashCashEquivalentsRestrictedCashAndRestrictedCashEquivalentsPeriodIncreaseDecreaseIncludingExchangeRateEffect",
                    "CashCashEquivalentsRestrictedCashAndRestrictedCashEquivalentsPeriodIncreaseDecreaseExcludingExchangeRateEffect",
                    "CashAndCashEquivalentsPeriodIncreaseDecrease",
                    "CashAndCashEquivalentsPeriodIncreaseDecreaseExcludingExchangeRateEffect",
                    "CashPeriodIncreaseDecrease");
    private static final String FX_EFFECT_PREFIX = "EffectOfExchangeRateOn";

    @Override
    public boolean appliesTo(StatementCode statement) {
        return statement.isCashFlow();
    }

    @Override
    public SubtotalCheck evaluate(List<StatementRow> rows, BigDecimal tolerance) {
        BigDecimal netChange = RowValues.firstValue(rows, NET_CHANGE_TAGS);
        List<StatementRow> cashRows = new ArrayList<>();
        for (StatementRow row : rows) {
            if (row.hasValue() && SemanticRules.isCashBalanceConcept(row.getTag())) {
                cashRows.add(row);
            }
        }
        BigDecimal beginning = boundary(cashRows, ConceptRole.BEGINNING_BALANCE);
        BigDecimal ending = boundary(cashRows, ConceptRole.ENDING_BALANCE);
        if (beginning == null && ending == null && cashRows.size() >= 2) {
            beginning = cashRows.get(0).getValue();
            ending = cashRows.get(cashRows.size() - 1).getValue();
        }
        if (netChange == null || beginning == null || ending == null) {
            return SubtotalCheck.notApplicable(NAME);
        }
        BigDecimal expected = ending.subtract(beginning);
        SubtotalCheck plain = SubtotalCheck.compare(NAME, netChange, expected, tolerance, NET_CHANGE);
        if (plain.isPassed()) {
            return plain;
        }
        BigDecimal fx = fxEffect(rows);
        if (fx != null) {
            SubtotalCheck adjusted =
                    SubtotalCheck.compare(NAME, netChange.add(fx), expected, tolerance, NET_CHANGE_PLUS_FX);
            if (adjusted.isPassed()) {
                return adjusted;
            }
        }
        return plain;
    }

    private static BigDecimal boundary(List<StatementRow> cashRows, ConceptRole role) {
        for (StatementRow row : cashRows) {
            Optional<ConceptRole> rowRole = SemanticRules.labelRole(row.getLabel());
            if (rowRole.isPresent() && rowRole.get() == role) {
                return row.getValue();
            }
        }
        return null;
    }

    private static BigDecimal fxEffect(List<StatementRow> rows) {
        for (StatementRow row : rows) {
            if (row.hasValue() && row.getTag().startsWith(FX_EFFECT_PREFIX)) {
                return row.getValue();
            }
        }
        return null;
    }
}
