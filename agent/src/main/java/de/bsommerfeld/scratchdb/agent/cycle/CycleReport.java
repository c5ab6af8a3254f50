package de.bsommerfeld.scratchdb.agent.cycle;

import de.bsommerfeld.scratchdb.agent.sync.SyncResult;
import de.bsommerfeld.scratchdb.agent.sync.TaskBoardSnapshot;
import de.bsommerfeld.scratchdb.db.digest.DatabaseDigest;
import de.bsommerfeld.scratchdb.db.storage.ScratchDatabaseLifecycle.PersistOutcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one processing cycle.
 *
 * @param syncResults  reconcile result per mirror domain, in cycle order
 * @param taskBoard    the agent's board after the cycle, only when the task
 *                     board changed
 * @param digest       digest of the scratch database after reconcile, or
 *                     {@code null} when the session never opened
 * @param errors       every error of the cycle, sync errors included
 */
public record CycleReport(
        String agentId,
        Map<String, SyncResult> syncResults,
        TaskBoardSnapshot taskBoard,
        DatabaseDigest digest,
        List<String> errors,
        PersistOutcome persistOutcome) {

    public CycleReport {
        syncResults = Collections.unmodifiableMap(new LinkedHashMap<>(syncResults));
        errors = List.copyOf(errors);
    }

    public Optional<SyncResult> syncResult(String domain) {
        return Optional.ofNullable(syncResults.get(domain));
    }

    public Optional<TaskBoardSnapshot> changedTaskBoard() {
        return Optional.ofNullable(taskBoard);
    }

    public Optional<DatabaseDigest> digestIfPresent() {
        return Optional.ofNullable(digest);
    }

    /** Whether any mirror domain changed durable state. */
    public boolean recordsChanged() {
        return syncResults.values().stream().anyMatch(SyncResult::changed);
    }

    /** Errors raised by the synchronizers only, for the agent's next prompt. */
    public List<String> syncErrors() {
        List<String> all = new ArrayList<>();
        for (SyncResult result : syncResults.values())
            all.addAll(result.errors());
        return all;
    }
}
