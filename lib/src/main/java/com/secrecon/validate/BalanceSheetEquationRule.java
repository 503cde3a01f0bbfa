package com.secrecon.validate;

import com.secrecon.model.StatementCode;
import com.secrecon.model.StatementRow;
import java.math.BigDecimal;
import java.util.List;

/** Total assets must equal total liabilities and equity. */
final class BalanceSheetEquationRule implements SubtotalRule {
    static final String NAME = "balance_sheet_equation";

    private static final List<String> ASSET_TAGS = List.of("Assets");
    private static final List<String> LIABILITY_AND_EQUITY_TAGS =
            List.of(
                    "LiabilitiesAndStockholdersEquity",
                    "LiabilitiesAndStockholdersEquityIncludingPortionAttributableToNoncontrollingInterest");

    @Override
    public boolean appliesTo(StatementCode statement) {
        return statement.isBalanceSheet();
    }

    @Override
    public SubtotalCheck evaluate(List<StatementRow> rows, BigDecimal tolerance) {
        BigDecimal assets = RowValues.firstValue(rows, ASSET_TAGS);
        BigDecimal liabilitiesAndEquity = RowValues.firstValue(rows, LIABILITY_AND_EQUITY_TAGS);
        if (assets == null || liabilitiesAndEquity == null) {
            return SubtotalCheck.notApplicable(NAME);
        }
        return SubtotalCheck.compare(NAME, assets, liabilitiesAndEquity, tolerance, null);
    }
}
