package de.bsommerfeld.scratchdb.core.domain;

import java.time.Instant;

/**
 * Durable task-board card. {@code completedAt} is set exactly while the card
 * is {@link TaskStatus#DONE}.
 */
public record TaskCard(
        String id,
        String title,
        String description,
        TaskStatus status,
        int priority,
        String assignedAgentId,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt) {

    public TaskCard withStatus(TaskStatus newStatus, Instant now) {
        Instant completed = completedAt;
        if (newStatus.isTerminal() && completed == null) {
            completed = now;
        } else if (!newStatus.isTerminal()) {
            completed = null;
        }
        return new TaskCard(id, title, description, newStatus, priority, assignedAgentId, createdAt, now,
                completed);
    }
}
