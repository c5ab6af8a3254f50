package de.bsommerfeld.scratchdb.agent.sync;

import de.bsommerfeld.scratchdb.core.domain.AgentIdentity;
import de.bsommerfeld.scratchdb.db.store.RecordTransaction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one apply pass: the open durable transaction plus what
 * the domain created, updated, removed and rejected so far.
 */
public final class ApplyContext {

    private final AgentIdentity agent;
    private final RecordTransaction tx;
    private final Instant now;
    private final List<String> created = new ArrayList<>();
    private final List<String> updated = new ArrayList<>();
    private final List<String> removed = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final List<RecordChange> changes = new ArrayList<>();

    ApplyContext(AgentIdentity agent, RecordTransaction tx, Instant now) {
        this.agent = agent;
        this.tx = tx;
        this.now = now;
    }

    public AgentIdentity agent() {
        return agent;
    }

    public String agentId() {
        return agent.agentId();
    }

    public RecordTransaction tx() {
        return tx;
    }

    public Instant now() {
        return now;
    }

    public void created(String id) {
        created.add(id);
    }

    public void updated(String id) {
        updated.add(id);
    }

    public void removed(String id) {
        removed.add(id);
    }

    public void error(String message) {
        errors.add(message);
    }

    public void change(RecordChange change) {
        changes.add(change);
    }

    SyncResult toResult(String domain, List<String> readErrors) {
        List<String> allErrors = new ArrayList<>(readErrors);
        allErrors.addAll(errors);
        return new SyncResult(domain, created, updated, removed, allErrors, changes);
    }
}
