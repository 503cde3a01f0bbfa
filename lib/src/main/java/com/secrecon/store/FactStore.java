package com.secrecon.store;

import com.secrecon.model.NumericFact;
import java.util.List;

/** Read-only source of numeric facts. */
public interface FactStore {

    /**
     * All facts recorded for one filing, in a stable order.
     *
     * @return the facts, possibly empty. Implementations must not return null.
     */
    List<NumericFact> factsFor(String filingId);
}
