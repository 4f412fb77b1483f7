package com.mythos.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setTurn puts the turn number in MDC")
    void setTurn() {
        MdcContext.setTurn(12);
        assertEquals("12", MDC.get("turn"));
    }

    @Test
    @DisplayName("clearObjective keeps the turn")
    void clearObjective() {
        MdcContext.setTurn(3);
        MdcContext.setObjective("library_search");
        assertEquals("library_search", MDC.get("objectiveId"));

        MdcContext.clearObjective();
        assertNull(MDC.get("objectiveId"));
        assertEquals("3", MDC.get("turn"));
    }

    @Test
    @DisplayName("clear removes all mythos MDC keys")
    void clear() {
        MdcContext.setTurn(3);
        MdcContext.setObjective("library_search");
        MdcContext.clear();
        assertNull(MDC.get("turn"));
        assertNull(MDC.get("objectiveId"));
    }
}
