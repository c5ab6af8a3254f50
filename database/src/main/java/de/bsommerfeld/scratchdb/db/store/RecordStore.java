package de.bsommerfeld.scratchdb.db.store;

import de.bsommerfeld.scratchdb.core.domain.AgentSettings;
import de.bsommerfeld.scratchdb.core.domain.Skill;
import de.bsommerfeld.scratchdb.core.domain.TaskCard;

import java.util.List;

/**
 * Durable record contract behind the mirror tables. The synchronizer reads
 * through the plain query methods when it seeds a mirror and mutates only
 * inside {@link #inTransaction}, one transaction per domain.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlRecordStore} - production persistence via SQLite</li>
 * <li>{@link InMemoryRecordStore} - map-backed store for TEST mode, no disk
 * I/O</li>
 * </ul>
 * Switching between them is done at the Guice module level.
 *
 * <p>
 * Every method throws {@link RecordStoreException} when the underlying store
 * fails; none of them return partial data.
 */
public interface RecordStore {

    /**
     * Returns every card in the given scope, ordered by priority descending
     * then creation time ascending. Cards assigned to other agents of the
     * same scope are included.
     */
    List<TaskCard> findVisibleCards(String scopeId);

    /** Returns the cards assigned to one agent, in board order. */
    List<TaskCard> findAssignedCards(String agentId);

    /** Returns every stored skill version of an agent, ordered by name then version. */
    List<Skill> findSkills(String agentId);

    /**
     * Returns the agent's settings, or {@link AgentSettings#empty()} when none
     * were ever saved.
     */
    AgentSettings findSettings(String agentId);

    /**
     * Runs {@code work} in a single transaction. If the work throws, every
     * change it made is rolled back and the exception propagates.
     */
    <T> T inTransaction(TransactionWork<T> work);
}
