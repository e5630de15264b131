package com.noi.backend.services.extraction.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class AttemptStrategyTest {

    @Test
    void forAttempt_escalatesAndThenRepeatsLastStrategy() {
        assertEquals(AttemptStrategy.STANDARD, AttemptStrategy.forAttempt(1));
        assertEquals(AttemptStrategy.EMPHATIC, AttemptStrategy.forAttempt(2));
        assertEquals(AttemptStrategy.WORKED_EXAMPLE, AttemptStrategy.forAttempt(3));
        assertEquals(AttemptStrategy.WORKED_EXAMPLE, AttemptStrategy.forAttempt(7));
        assertEquals(0.1, AttemptStrategy.STANDARD.getTemperature());
    }
}
