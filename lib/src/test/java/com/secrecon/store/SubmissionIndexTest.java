package com.secrecon.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.secrecon.model.SubmissionRecord;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

final class SubmissionIndexTest {

    private static final SubmissionIndex INDEX =
            new SubmissionIndex(
                    List.of(
                            submission("a-1", "100", "10-Q", "2024-11-05"),
                            submission("b-1", "200", "10-K", "2024-02-20"),
                            submission("a-2", "100", "10-K", "2024-02-15"),
                            submission("c-1", "300", "10-K", "2024-02-20"),
                            submission("d-1", "400", "8-K", null)));

    @Test
    void samplesNewestFirstWithFilingIdTieBreak() {
        assertEquals(List.of("a-1", "b-1", "c-1", "a-2", "d-1"), INDEX.sample(10, List.of(), false));
    }

    @Test
    void filtersFormsCaseInsensitively() {
        assertEquals(List.of("b-1", "c-1", "a-2"), INDEX.sample(10, List.of("10-k"), false));
    }

    @Test
    void keepsOneFilingPerCompanyWhenAsked() {
        assertEquals(List.of("a-1", "b-1", "c-1", "d-1"), INDEX.sample(10, List.of(), true));
    }

    @Test
    void honoursLimit() {
        assertEquals(List.of("a-1", "b-1"), INDEX.sample(2, List.of(), true));
        assertTrue(INDEX.sample(0, List.of(), false).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> INDEX.sample(-1, List.of(), false));
    }

    @Test
    void looksUpByFilingAndCompany() {
        assertEquals("10-K", INDEX.find("a-2").orElseThrow().getForm());
        assertTrue(INDEX.find("zzz").isEmpty());
        assertEquals(2, INDEX.filingsForCompany("100").size());
    }

    private static SubmissionRecord submission(String adsh, String cik, String form, String filed) {
        return new SubmissionRecord(
                adsh, cik, "Company " + cik, null, form, null, null, null, filed == null ? null : LocalDate.parse(filed), null);
    }
}
