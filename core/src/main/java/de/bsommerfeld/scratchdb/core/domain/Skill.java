package de.bsommerfeld.scratchdb.core.domain;

import java.time.Instant;
import java.util.List;

/**
 * One immutable version of a named skill. Editing a skill writes a new row
 * with {@code version + 1}; older versions stay until the name is deleted.
 */
public record Skill(
        String id,
        String agentId,
        String name,
        String description,
        int version,
        List<String> tools,
        String instructions,
        Instant createdAt,
        Instant updatedAt) {

    public Skill {
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
