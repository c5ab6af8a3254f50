package de.bsommerfeld.scratchdb.agent.sync;

import de.bsommerfeld.scratchdb.core.domain.AgentIdentity;
import de.bsommerfeld.scratchdb.core.event.ApplicationEventBus;
import de.bsommerfeld.scratchdb.core.event.ControlEvents;
import de.bsommerfeld.scratchdb.db.guard.GuardedSession;
import de.bsommerfeld.scratchdb.db.schema.BuiltinTables;
import de.bsommerfeld.scratchdb.db.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot-diff-apply cycle for one {@link MirrorDomain}.
 *
 * <h3>Per cycle</h3>
 * <ol>
 * <li>{@link #seed}: drop and recreate the mirror table, insert one row per
 * durable record, remember the rows as the {@link Baseline}</li>
 * <li>the agent edits the table with ordinary SQL</li>
 * <li>{@link #reconcile}: read the table back, diff it against the baseline,
 * apply the validated delta in one durable transaction, drop the table</li>
 * </ol>
 *
 * Neither step throws. A failed seed yields no baseline, and reconciling
 * without a baseline only drops the table. Apply failures roll the whole
 * domain back and are reported as errors. The mirror table is dropped on
 * every reconcile path.
 */
public class MirrorSynchronizer<D, R> {

    private static final Logger LOG = LoggerFactory.getLogger(MirrorSynchronizer.class);

    private final MirrorDomain<D, R> domain;
    private final RecordStore store;
    private final ApplicationEventBus eventBus;
    private final Clock clock;

    public MirrorSynchronizer(MirrorDomain<D, R> domain, RecordStore store, ApplicationEventBus eventBus) {
        this(domain, store, eventBus, Clock.systemUTC());
    }

    MirrorSynchronizer(MirrorDomain<D, R> domain, RecordStore store, ApplicationEventBus eventBus, Clock clock) {
        this.domain = domain;
        this.store = store;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public MirrorDomain<D, R> domain() {
        return domain;
    }

    // =====================================================================
    // Seed
    // =====================================================================

    /**
     * @return the baseline, or empty if the store or the scratch database
     *         failed; the mirror table is absent in that case
     */
    public Optional<Baseline<R>> seed(GuardedSession session, AgentIdentity agent) {
        try {
            List<D> records = domain.load(store, agent);
            writeMirror(session, agent, records);

            Map<String, R> rows = new LinkedHashMap<>();
            for (D record : records) {
                R row = domain.toRow(record);
                rows.put(domain.idOf(row), row);
            }
            LOG.debug("Seeded {} with {} rows for agent {}", domain.table(), rows.size(), agent.agentId());
            return Optional.of(new Baseline<>(rows));
        } catch (SQLException | RuntimeException e) {
            LOG.error("Failed to seed {} mirror for agent {}", domain.name(), agent.agentId(), e);
            teardown(session);
            return Optional.empty();
        }
    }

    private void writeMirror(GuardedSession session, AgentIdentity agent, List<D> records) throws SQLException {
        session.begin();
        try {
            session.execute("DROP TABLE IF EXISTS " + BuiltinTables.quote(domain.table()));
            session.execute(domain.createTableSql(agent));
            if (!records.isEmpty()) {
                session.execute(domain.insertSql(), ps -> {
                    for (D record : records) {
                        domain.bindInsert(ps, record);
                        ps.addBatch();
                    }
                    return ps.executeBatch();
                });
            }
            session.commit();
        } catch (SQLException | RuntimeException e) {
            session.rollback();
            throw e;
        }
    }

    // =====================================================================
    // Diff & Apply
    // =====================================================================

    /**
     * Applies the agent's edits and drops the mirror table.
     *
     * @param baseline the seed result, or {@code null} when seeding failed
     */
    public SyncResult reconcile(GuardedSession session, AgentIdentity agent, Baseline<R> baseline) {
        try {
            if (baseline == null)
                return SyncResult.unchanged(domain.name(), List.of());

            RowParse<R> current = readOrNull(session, agent);
            if (current == null)
                return SyncResult.unchanged(domain.name(),
                        List.of("Failed to read " + domain.table() + " table; no changes were applied."));

            MirrorDiff<R> diff = new MirrorDiff<>(baseline, current);
            if (diff.isEmpty())
                return SyncResult.unchanged(domain.name(), current.errors());

            SyncResult result = applyOrRollback(agent, diff, current.errors());
            log(agent, result);
            if (result.changed()) {
                eventBus.post(new ControlEvents.MirrorSyncedEvent(domain.name(), agent.agentId(),
                        result.created(), result.updated(), result.removed()));
            }
            return result;
        } finally {
            teardown(session);
        }
    }

    private RowParse<R> readOrNull(GuardedSession session, AgentIdentity agent) {
        try {
            return session.execute(domain.selectSql(), ps -> {
                RowParse<R> parse = new RowParse<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next())
                        domain.parseRow(rs, agent, parse);
                }
                return parse;
            });
        } catch (SQLException | RuntimeException e) {
            LOG.warn("Failed to read {} mirror for agent {}", domain.name(), agent.agentId(), e);
            return null;
        }
    }

    private SyncResult applyOrRollback(AgentIdentity agent, MirrorDiff<R> diff, List<String> readErrors) {
        try {
            return store.inTransaction(tx -> {
                ApplyContext ctx = new ApplyContext(agent, tx, clock.instant());
                domain.apply(diff, ctx);
                return ctx.toResult(domain.name(), readErrors);
            });
        } catch (RuntimeException e) {
            LOG.error("Applying {} changes failed for agent {}, rolled back", domain.name(), agent.agentId(), e);
            List<String> errors = new ArrayList<>(readErrors);
            errors.add("Failed to apply " + domain.name() + " changes, nothing was saved: " + e.getMessage());
            return SyncResult.unchanged(domain.name(), errors);
        }
    }

    private void log(AgentIdentity agent, SyncResult result) {
        if (result.changed()) {
            LOG.info("[SYNC] {} for agent {}: {} created, {} updated, {} removed, {} errors", domain.name(),
                    agent.agentId(), result.created().size(), result.updated().size(), result.removed().size(),
                    result.errors().size());
        } else if (!result.errors().isEmpty()) {
            LOG.info("[SYNC] {} for agent {}: no changes, {} errors", domain.name(), agent.agentId(),
                    result.errors().size());
        }
    }

    // =====================================================================
    // Teardown
    // =====================================================================

    /** Drops the mirror table. Safe to call when it does not exist. */
    public void teardown(GuardedSession session) {
        try {
            session.execute("DROP TABLE IF EXISTS " + BuiltinTables.quote(domain.table()));
        } catch (SQLException | RuntimeException e) {
            LOG.error("Failed to drop {} mirror table", domain.table(), e);
        }
    }
}
