package de.bsommerfeld.scratchdb.agent.sync;

import java.util.List;

/**
 * Outcome of reconciling one mirror table. Errors are data: a reconcile never
 * throws, and every rejected row is described here.
 */
public record SyncResult(
        String domain,
        List<String> created,
        List<String> updated,
        List<String> removed,
        List<String> errors,
        List<RecordChange> changes) {

    public SyncResult {
        created = List.copyOf(created);
        updated = List.copyOf(updated);
        removed = List.copyOf(removed);
        errors = List.copyOf(errors);
        changes = List.copyOf(changes);
    }

    static SyncResult unchanged(String domain, List<String> errors) {
        return new SyncResult(domain, List.of(), List.of(), List.of(), errors, List.of());
    }

    /** Whether durable state changed. */
    public boolean changed() {
        return !created.isEmpty() || !updated.isEmpty() || !removed.isEmpty();
    }
}
