package de.bsommerfeld.scratchdb.agent.sync;

import de.bsommerfeld.scratchdb.core.domain.TaskStatus;

/**
 * One change applied to a durable record, for activity timelines.
 * {@code fromStatus} and {@code toStatus} are {@code null} where they do not
 * apply.
 */
public record RecordChange(String recordId, String title, Action action, TaskStatus fromStatus,
        TaskStatus toStatus) {

    public enum Action {
        CREATED,
        STARTED,
        COMPLETED,
        UPDATED,
        /** Removed after it was already done. */
        ARCHIVED,
        /** Removed while still open. */
        DELETED
    }
}
