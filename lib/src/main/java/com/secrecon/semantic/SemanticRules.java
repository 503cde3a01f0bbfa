package com.secrecon.semantic;

import java.util.List;
import java.util.Optional;

/**
 * The keyword tables used to infer accounting roles from labels and tags. Rules within a table are
 * tried in order and the first match wins.
 */
public final class SemanticRules {

    /** Row roles read from presentation labels. */
    public static final List<KeywordRule> LABEL_ROLES =
            List.of(
                    KeywordRule.of(ConceptRole.BEGINNING_BALANCE, "beginning", "start of"),
                    KeywordRule.of(ConceptRole.ENDING_BALANCE, "ending", "end of"),
                    KeywordRule.of(ConceptRole.BALANCE, "balance"));

    /** Direction of cash-flow line items read from concept tags. Outflow keywords are tried first. */
    public static final List<KeywordRule> CASH_FLOW_DIRECTION =
            List.of(
                    KeywordRule.of(ConceptRole.OUTFLOW, "payment", "repurchase", "repay", "purchase"),
                    KeywordRule.of(ConceptRole.INFLOW, "proceeds", "issuance", "borrowings", "borrow"));

    /** Equity movements read from concept tags. */
    public static final List<KeywordRule> EQUITY_MOVEMENT =
            List.of(KeywordRule.of(ConceptRole.EQUITY_REDUCTION, "dividend", "repurchase", "purchases", "payment"));

    /** Tags whose rows are expected to have no numeric value. */
    public static final List<KeywordRule> DISCLOSURE_PATTERNS =
            List.of(
                    KeywordRule.of(
                            ConceptRole.NON_NUMERIC_DISCLOSURE,
                            "CommitmentsAndContingencies",
                            "TextBlock",
                            "Abstract",
                            "Policy"));

    /** Balance-sheet section of a concept tag. */
    public static final List<KeywordRule> BALANCE_SHEET_SECTIONS =
            List.of(
                    KeywordRule.of(ConceptRole.ASSET, "asset"),
                    KeywordRule.of(ConceptRole.LIABILITY, "liab", "payable"),
                    KeywordRule.of(ConceptRole.EQUITY, "equity", "stockholders", "common"));

    /** Income-statement section of a concept tag. */
    public static final List<KeywordRule> INCOME_STATEMENT_SECTIONS =
            List.of(
                    KeywordRule.of(ConceptRole.REVENUE, "revenue", "sales"),
                    KeywordRule.of(ConceptRole.EXPENSE, "expense", "cost", "depreciation"),
                    KeywordRule.of(ConceptRole.INCOME, "earnings", "profit", "loss", "income"));

    /** Cash-flow activity of a concept tag. */
    public static final List<KeywordRule> CASH_FLOW_SECTIONS =
            List.of(
                    KeywordRule.of(ConceptRole.OPERATING_ACTIVITY, "operating", "depreciation", "amortization"),
                    KeywordRule.of(ConceptRole.INVESTING_ACTIVITY, "invest", "capital", "property"),
                    KeywordRule.of(ConceptRole.FINANCING_ACTIVITY, "financ", "debt", "equity", "dividend"));

    static final String CASH_CONCEPT_PREFIX = "Cash";
    static final List<String> CASH_CONCEPT_EXCLUSIONS = List.of("IncreaseDecrease", "Period", "Effect");

    private SemanticRules() {}

    public static Optional<ConceptRole> firstMatch(List<KeywordRule> rules, String text) {
        for (KeywordRule rule : rules) {
            if (rule.matches(text)) {
                return Optional.of(rule.getRole());
            }
        }
        return Optional.empty();
    }

    /** Beginning, ending or plain balance role of a presentation label, if any. */
    public static Optional<ConceptRole> labelRole(String label) {
        return firstMatch(LABEL_ROLES, label);
    }

    public static Optional<ConceptRole> cashFlowDirection(String tag) {
        return firstMatch(CASH_FLOW_DIRECTION, tag);
    }

    public static boolean isEquityReduction(String tag) {
        return firstMatch(EQUITY_MOVEMENT, tag).isPresent();
    }

    public static boolean isNonNumericDisclosure(String tag) {
        return firstMatch(DISCLOSURE_PATTERNS, tag).isPresent();
    }

    public static Optional<ConceptRole> balanceSheetSection(String tag) {
        return firstMatch(BALANCE_SHEET_SECTIONS, tag);
    }

    public static Optional<ConceptRole> incomeStatementSection(String tag) {
        return firstMatch(INCOME_STATEMENT_SECTIONS, tag);
    }

    public static Optional<ConceptRole> cashFlowSection(String tag) {
        return firstMatch(CASH_FLOW_SECTIONS, tag);
    }

    /**
     * Whether the tag names the cash balance rolled forward by a cash-flow statement, as opposed to
     * a change in cash or an exchange-rate effect on it.
     */
    public static boolean isCashBalanceConcept(String tag) {
        if (tag == null || !tag.startsWith(CASH_CONCEPT_PREFIX)) {
            return false;
        }
        for (String exclusion : CASH_CONCEPT_EXCLUSIONS) {
            if (tag.contains(exclusion)) {
                return false;
            }
        }
        return true;
    }
}
