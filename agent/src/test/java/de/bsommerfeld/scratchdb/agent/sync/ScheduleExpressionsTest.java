package de.bsommerfeld.scratchdb.agent.sync;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleExpressionsTest {

    @Test
    void validate_shouldAcceptAliases() {
        for (String alias : ScheduleExpressions.ALIASES)
            assertTrue(ScheduleExpressions.validate(alias).isEmpty(), alias);
        assertTrue(ScheduleExpressions.validate(" @DAILY ").isEmpty());
    }

    @Test
    void validate_shouldRejectUnknownAlias() {
        assertEquals(Optional.of("unknown schedule alias '@often'"), ScheduleExpressions.validate("@often"));
    }

    @Test
    void validate_shouldAcceptCommonExpressions() {
        assertTrue(ScheduleExpressions.validate("0 9 * * 1-5").isEmpty());
        assertTrue(ScheduleExpressions.validate("30 */2 1,15 JAN-JUN mon").isEmpty());
        assertTrue(ScheduleExpressions.validate("0,30 * * * *").isEmpty());
        assertTrue(ScheduleExpressions.validate("15 3 * * 7").isEmpty());
    }

    @Test
    void validate_shouldRejectWrongFieldCount() {
        assertEquals(Optional.of("expected 5 cron fields (minute hour day month weekday), got 4"),
                ScheduleExpressions.validate("0 9 * *"));
    }

    @Test
    void validate_shouldRejectOutOfRangeValues() {
        assertTrue(ScheduleExpressions.validate("60 * * * *").orElseThrow().contains("minute value out of range"));
        assertTrue(ScheduleExpressions.validate("0 24 * * *").orElseThrow().contains("hour value out of range"));
        assertTrue(ScheduleExpressions.validate("0 0 0 * *").orElseThrow().contains("day-of-month"));
        assertTrue(ScheduleExpressions.validate("0 0 * 13 *").orElseThrow().contains("month"));
    }

    @Test
    void validate_shouldRejectSyntaxErrors() {
        assertEquals(Optional.of("invalid hour value 'x'"), ScheduleExpressions.validate("0 x * * *"));
        assertTrue(ScheduleExpressions.validate("0 1,,2 * * *").orElseThrow().startsWith("empty entry"));
        assertTrue(ScheduleExpressions.validate("0 */0 * * *").orElseThrow().startsWith("step must be positive"));
        assertTrue(ScheduleExpressions.validate("   ").isPresent());
    }

    @Test
    void validate_shouldLimitFrequency() {
        assertEquals(Optional.of("Schedule is too frequent (runs more than twice per hour)."),
                ScheduleExpressions.validate("* * * * *"));
        assertEquals(Optional.of("Schedule is too frequent (interval is less than 30 minutes)."),
                ScheduleExpressions.validate("0,15 * * * *"));
        assertEquals(Optional.of("Schedule is too frequent (interval is less than 30 minutes)."),
                ScheduleExpressions.validate("5,40 * * * *"));
    }

    @Test
    void expand_shouldHandleStepsFromAStart() {
        assertEquals(Set.of(10, 30, 50), ScheduleExpressions.expand("10/20", 0, 59, List.of(), "minute"));
    }
}
