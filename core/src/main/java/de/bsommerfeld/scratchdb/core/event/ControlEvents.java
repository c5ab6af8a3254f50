package de.bsommerfeld.scratchdb.core.event;

import java.util.List;

/**
 * Cross-module events. Only events that more than one module produces or
 * consumes belong here.
 */
public class ControlEvents {

    /**
     * Fired after a mirror table reconcile committed at least one change to
     * durable storage.
     */
    public record MirrorSyncedEvent(String domain, String agentId, List<String> created,
            List<String> updated, List<String> removed) {
        public MirrorSyncedEvent {
            created = List.copyOf(created);
            updated = List.copyOf(updated);
            removed = List.copyOf(removed);
        }
    }

    /**
     * Fired when a scratch database exceeded the hard ceiling at persist time
     * and its archive was deleted instead of written.
     */
    public record ScratchDatabaseWipedEvent(String agentId, long sizeBytes) {
    }

    /** Fired when a batch leaves the scratch database above the soft ceiling. */
    public record ScratchDatabaseSizeWarningEvent(String agentId, long sizeBytes) {
    }
}
