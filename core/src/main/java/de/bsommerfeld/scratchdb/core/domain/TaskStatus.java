package de.bsommerfeld.scratchdb.core.domain;

import java.util.Locale;
import java.util.Optional;

public enum TaskStatus {

    TODO,
    DOING,
    DONE;

    /** Lower-case wire value used in the task-board mirror table. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == DONE;
    }

    /**
     * Parses a mirror-table status. Case and surrounding whitespace are
     * ignored; anything else yields empty.
     */
    public static Optional<TaskStatus> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (TaskStatus status : values()) {
            if (status.name().equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
