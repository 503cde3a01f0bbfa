package com.secrecon.validate;

import com.secrecon.model.StatementCode;
import com.secrecon.model.StatementRow;
import java.math.BigDecimal;
import java.util.List;

/**
 * An arithmetic identity over one statement family. Rules compare raw (pre-sign) values and are
 * deterministic, so repeated runs over the same rows agree.
 */
public interface SubtotalRule {

    /** Whether the rule speaks about the given statement. */
    boolean appliesTo(StatementCode statement);

    /**
     * Evaluate this rule against the reconstructed rows.
     *
     * @return the check result; not applicable when the rows lack the needed inputs
     */
    SubtotalCheck evaluate(List<StatementRow> rows, BigDecimal tolerance);
}
