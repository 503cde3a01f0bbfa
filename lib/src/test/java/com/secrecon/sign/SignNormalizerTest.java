package com.secrecon.sign;

import static com.secrecon.testing.Fixtures.dec;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.secrecon.model.StatementCode;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

final class SignNormalizerTest {

    @Test
    void missingValueStaysMissing() {
        assertNull(SignNormalizer.normalize(StatementCode.CF, "PaymentsOfDividends", null, true));
    }

    @Test
    void negatingFlagFlipsPlainRows() {
        assertEquals(dec("-25"), SignNormalizer.normalize(StatementCode.IS, "InterestExpense", dec("25"), true));
        assertEquals(dec("25"), SignNormalizer.normalize(StatementCode.IS, "InterestExpense", dec("25"), false));
    }

    @Test
    void cashOutflowsAreAlwaysNegative() {
        assertEquals(
                dec("-120"),
                SignNormalizer.normalize(StatementCode.CF, "PaymentsToAcquirePropertyPlantAndEquipment", dec("120"), false));
        assertEquals(
                dec("-120"),
                SignNormalizer.normalize(StatementCode.CF, "PaymentsToAcquirePropertyPlantAndEquipment", dec("120"), true));
        assertEquals(
                dec("-120"),
                SignNormalizer.normalize(StatementCode.CF, "PaymentsToAcquirePropertyPlantAndEquipment", dec("-120"), true));
    }

    @Test
    void repurchasesOnCashFlowNeverComeOutPositive() {
        String[] raws = {"0", "1", "-1", "1500000", "-1500000", "0.01"};
        for (String raw : raws) {
            for (boolean negating : new boolean[] {true, false}) {
                BigDecimal shown =
                        SignNormalizer.normalize(StatementCode.CF, "PaymentsForRepurchaseOfCommonStock", dec(raw), negating);
                assertTrue(shown.signum() <= 0, raw + " negating=" + negating + " gave " + shown);
            }
        }
    }

    @Test
    void cashInflowsAreAlwaysPositive() {
        assertEquals(
                dec("300"), SignNormalizer.normalize(StatementCode.CF, "ProceedsFromIssuanceOfLongTermDebt", dec("-300"), false));
        assertEquals(
                dec("300"), SignNormalizer.normalize(StatementCode.CF, "ProceedsFromIssuanceOfLongTermDebt", dec("300"), true));
    }

    @Test
    void outflowKeywordsWinOverInflowKeywords() {
        assertEquals(
                dec("-40"), SignNormalizer.normalize(StatementCode.CF, "RepaymentsOfDebtProceeds", dec("40"), false));
    }

    @Test
    void otherCashFlowRowsKeepTheirSign() {
        assertEquals(dec("-7"), SignNormalizer.normalize(StatementCode.CF, "IncreaseDecreaseInInventories", dec("7"), true));
        assertEquals(dec("250"), SignNormalizer.normalize(StatementCode.CF, "NetIncomeLoss", dec("250"), false));
    }

    @Test
    void equityReductionsAreNegative() {
        assertEquals(dec("-40000"), SignNormalizer.normalize(StatementCode.EQ, "DividendsCommonStock", dec("40000"), false));
        assertEquals(dec("-40000"), SignNormalizer.normalize(StatementCode.EQ, "DividendsCommonStock", dec("40000"), true));
        assertEquals(
                dec("-9"), SignNormalizer.normalize(StatementCode.EQ, "StockRepurchasedDuringPeriodValue", dec("-9"), false));
    }

    @Test
    void equityIncreasesFollowOnlyTheNegatingFlag() {
        assertEquals(dec("70"), SignNormalizer.normalize(StatementCode.EQ, "NetIncomeLoss", dec("70"), false));
        assertEquals(dec("-70"), SignNormalizer.normalize(StatementCode.EQ, "NetIncomeLoss", dec("70"), true));
    }

    @Test
    void balanceSheetRowsIgnoreTagKeywords() {
        assertEquals(
                dec("15"), SignNormalizer.normalize(StatementCode.BS, "DividendsPayableCurrent", dec("15"), false));
    }

    @Test
    void statementIsRequired() {
        assertThrows(NullPointerException.class, () -> SignNormalizer.normalize(null, "Assets", dec("1"), false));
    }
}
