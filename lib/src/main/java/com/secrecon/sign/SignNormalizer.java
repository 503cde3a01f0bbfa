package com.secrecon.sign;

import com.secrecon.model.StatementCode;
import com.secrecon.semantic.ConceptRole;
import com.secrecon.semantic.SemanticRules;
import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a raw fact value into its displayed value. The row's negation flag is applied first;
 * cash-flow and equity line items then get a sign forced by the role their tag names.
 */
public final class SignNormalizer {

    private SignNormalizer() {}

    public static BigDecimal normalize(StatementCode statement, String tag, BigDecimal raw, boolean negating) {
        Objects.requireNonNull(statement, "statement");
        if (raw == null) {
            return null;
        }
        BigDecimal signed = negating ? raw.negate() : raw;
        if (statement.isCashFlow()) {
            Optional<ConceptRole> direction = SemanticRules.cashFlowDirection(tag);
            if (direction.isPresent()) {
                return direction.get() == ConceptRole.OUTFLOW ? signed.abs().negate() : signed.abs();
            }
        } else if (statement.isEquity() && SemanticRules.isEquityReduction(tag)) {
            return signed.abs().negate();
        }
        return signed;
    }
}
