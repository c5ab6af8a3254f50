package de.bsommerfeld.scratchdb.agent.sync;

import de.bsommerfeld.scratchdb.core.domain.AgentIdentity;
import de.bsommerfeld.scratchdb.db.store.RecordStore;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * What {@link MirrorSynchronizer} needs to know about one synchronized
 * domain.
 *
 * @param <D> durable record type read from the {@link RecordStore}
 * @param <R> mirror row tuple; {@code equals} decides whether a row changed
 */
public interface MirrorDomain<D, R> {

    /** Short name used in logs, events and results, e.g. {@code task_board}. */
    String name();

    /** Mirror table inside the scratch database. */
    String table();

    /** {@code CREATE TABLE} statement for the mirror. */
    String createTableSql(AgentIdentity agent);

    /** Durable records the mirror is seeded with. */
    List<D> load(RecordStore store, AgentIdentity agent);

    /** Parameterized {@code INSERT} used to seed one record. */
    String insertSql();

    void bindInsert(PreparedStatement ps, D record) throws SQLException;

    /** Baseline tuple of a seeded record. */
    R toRow(D record);

    String idOf(R row);

    /** {@code SELECT} reading the mirror back; columns as {@link #parseRow} expects. */
    String selectSql();

    void parseRow(ResultSet rs, AgentIdentity agent, RowParse<R> parse) throws SQLException;

    /**
     * Validates and applies the diff inside the open durable transaction.
     * Rejections are reported through {@link ApplyContext#error}; throwing
     * rolls back the whole domain.
     */
    void apply(MirrorDiff<R> diff, ApplyContext ctx);
}
