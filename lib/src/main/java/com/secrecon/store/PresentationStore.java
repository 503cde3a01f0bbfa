package com.secrecon.store;

import com.secrecon.model.PresentationRow;
import com.secrecon.model.StatementCode;
import java.util.List;

/** Read-only source of presentation rows. */
public interface PresentationStore {

    /**
     * Presentation rows of one statement of one filing. The rows are pre-filtered but carry no
     * ordering guarantee; callers sort them.
     *
     * @return the rows, possibly empty. Implementations must not return null.
     */
    List<PresentationRow> structureFor(String filingId, StatementCode statement);
}
