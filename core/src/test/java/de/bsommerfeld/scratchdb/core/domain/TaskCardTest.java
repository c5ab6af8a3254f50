package de.bsommerfeld.scratchdb.core.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskCardTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2024-01-02T00:00:00Z");

    @Test
    void withStatus_shouldStampCompletionWhenEnteringDone() {
        TaskCard card = card(TaskStatus.DOING, null).withStatus(TaskStatus.DONE, T1);
        assertEquals(T1, card.completedAt());
        assertEquals(T1, card.updatedAt());
    }

    @Test
    void withStatus_shouldKeepExistingCompletionStamp() {
        TaskCard card = card(TaskStatus.DONE, T0).withStatus(TaskStatus.DONE, T1);
        assertEquals(T0, card.completedAt());
    }

    @Test
    void withStatus_shouldClearCompletionWhenLeavingDone() {
        TaskCard card = card(TaskStatus.DONE, T0).withStatus(TaskStatus.TODO, T1);
        assertNull(card.completedAt());
    }

    @Test
    void parse_shouldAcceptMixedCaseAndRejectUnknown() {
        assertEquals(TaskStatus.DOING, TaskStatus.parse(" Doing ").orElseThrow());
        assertTrue(TaskStatus.parse("blocked").isEmpty());
        assertTrue(TaskStatus.parse(null).isEmpty());
        assertEquals("done", TaskStatus.DONE.value());
    }

    private static TaskCard card(TaskStatus status, Instant completedAt) {
        return new TaskCard("id", "Title", "", status, 0, "agent", T0, T0, completedAt);
    }
}
