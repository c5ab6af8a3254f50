package de.bsommerfeld.scratchdb.agent.sync;

import com.google.inject.Singleton;
import de.bsommerfeld.scratchdb.core.domain.AgentIdentity;
import de.bsommerfeld.scratchdb.core.domain.TaskCard;
import de.bsommerfeld.scratchdb.core.domain.TaskStatus;
import de.bsommerfeld.scratchdb.core.util.Identifiers;
import de.bsommerfeld.scratchdb.db.SqlLoader;
import de.bsommerfeld.scratchdb.db.schema.BuiltinTables;
import de.bsommerfeld.scratchdb.db.store.RecordStore;
import de.bsommerfeld.scratchdb.db.store.RecordStoreException;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Task board mirrored as {@code __kanban_cards}. Every card of the agent's
 * scope is seeded so the agent sees its peers' work, but only cards assigned
 * to the agent itself can be created, changed or removed.
 *
 * <p>
 * Inserting a card whose title matches an existing card (case-insensitive)
 * is rejected: it almost always means the agent tried to move a card by
 * inserting it again instead of updating its status.
 */
@Singleton
public class TaskBoardDomain extends RowwiseMirrorDomain<TaskCard, TaskBoardDomain.CardRow> {

    public static final String NAME = "task_board";
    static final int MAX_TITLE_LENGTH = 255;

    /** Mutable fields of one card as the agent sees them. */
    public record CardRow(String id, String title, String description, TaskStatus status, int priority,
            String assignedAgentId) {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String table() {
        return BuiltinTables.KANBAN_CARDS;
    }

    @Override
    public String createTableSql(AgentIdentity agent) {
        return SqlLoader.load("create-kanban-mirror")
                .replace("{agent_id}", agent.agentId().replace("'", "''"));
    }

    @Override
    public List<TaskCard> load(RecordStore store, AgentIdentity agent) {
        return store.findVisibleCards(agent.scopeId());
    }

    @Override
    public String insertSql() {
        return SqlLoader.load("insert-kanban-mirror");
    }

    @Override
    public void bindInsert(PreparedStatement ps, TaskCard card) throws SQLException {
        CardRow row = toRow(card);
        ps.setString(1, row.id());
        ps.setString(2, Identifiers.friendlyId(row.title(), row.id()));
        ps.setString(3, row.title());
        ps.setString(4, row.description());
        ps.setString(5, row.status().value());
        ps.setInt(6, row.priority());
        ps.setString(7, row.assignedAgentId());
        setTimestamp(ps, 8, card.createdAt());
        setTimestamp(ps, 9, card.updatedAt());
        setTimestamp(ps, 10, card.completedAt());
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value.toString());
        }
    }

    @Override
    public CardRow toRow(TaskCard card) {
        return new CardRow(card.id(), trim(card.title()), trim(card.description()), card.status(),
                card.priority(), trim(card.assignedAgentId()));
    }

    @Override
    public String idOf(CardRow row) {
        return row.id();
    }

    @Override
    public String selectSql() {
        return SqlLoader.load("select-kanban-mirror");
    }

    @Override
    public void parseRow(ResultSet rs, AgentIdentity agent, RowParse<CardRow> parse) throws SQLException {
        String id = trim(rs.getString("id"));
        if (id.isEmpty()) {
            parse.reject("Kanban row skipped: missing card id.");
            return;
        }

        String title = trim(rs.getString("title"));
        if (title.isEmpty()) {
            parse.protect(id, "Kanban row skipped for " + id + ": title is required.");
            return;
        }
        if (title.length() > MAX_TITLE_LENGTH)
            title = title.substring(0, MAX_TITLE_LENGTH);

        String rawStatus = rs.getString("status");
        Optional<TaskStatus> status = TaskStatus.parse(rawStatus);
        if (status.isEmpty()) {
            parse.protect(id, "Kanban row skipped for " + id + ": invalid status '" + rawStatus + "'.");
            return;
        }

        String assigned = trim(rs.getString("assigned_agent_id"));
        if (assigned.isEmpty())
            assigned = agent.agentId();

        parse.accept(id, new CardRow(id, title, trim(rs.getString("description")), status.get(),
                parsePriority(rs.getObject("priority")), assigned));
    }

    static int parsePriority(Object raw) {
        if (raw instanceof Number)
            return ((Number) raw).intValue();
        if (raw != null) {
            try {
                return Integer.parseInt(raw.toString().trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    // =====================================================================
    // Apply
    // =====================================================================

    @Override
    protected String label() {
        return "Kanban";
    }

    @Override
    protected String recordNoun() {
        return "tasks";
    }

    @Override
    protected String ownerField() {
        return "assigned_agent_id";
    }

    @Override
    protected boolean isOwnedBy(CardRow row, String agentId) {
        return agentId.equals(row.assignedAgentId());
    }

    @Override
    protected Optional<String> validateCreate(CardRow row, MirrorDiff<CardRow> diff, ApplyContext ctx) {
        Map<String, CardRow> baselineTitles = new HashMap<>();
        for (CardRow existing : diff.baseline().values())
            baselineTitles.putIfAbsent(existing.title().toLowerCase(Locale.ROOT), existing);

        CardRow existing = baselineTitles.get(row.title().toLowerCase(Locale.ROOT));
        if (existing == null)
            return Optional.empty();
        return Optional.of(String.format(
                "Kanban duplicate blocked: '%s' already exists (friendly_id: %s). "
                        + "Use UPDATE to change status, not INSERT. Cards persist across turns.",
                row.title(), Identifiers.friendlyId(existing.title(), existing.id())));
    }

    @Override
    protected void create(CardRow row, ApplyContext ctx) {
        if (!Identifiers.isUuid(row.id())) {
            ctx.error("Kanban create ignored for invalid card id: " + row.id());
            return;
        }
        String id = Identifiers.normalizeUuid(row.id());
        Instant now = ctx.now();
        TaskCard card = new TaskCard(id, row.title(), row.description(), row.status(), row.priority(),
                ctx.agentId(), now, now, row.status().isTerminal() ? now : null);
        try {
            ctx.tx().insertCard(ctx.agent().scopeId(), card);
        } catch (RecordStoreException e) {
            ctx.error("Kanban create failed for " + row.id() + ": " + e.getMessage());
            return;
        }
        ctx.created(id);
        ctx.change(new RecordChange(id, card.title(), RecordChange.Action.CREATED, null, card.status()));
    }

    @Override
    protected void update(CardRow before, CardRow after, ApplyContext ctx) {
        Optional<TaskCard> stored = ctx.tx().findOwnedCard(ctx.agentId(), after.id());
        if (stored.isEmpty()) {
            ctx.error("Kanban update ignored for " + after.id() + ": card not owned by this agent.");
            return;
        }

        TaskCard current = stored.get();
        TaskStatus oldStatus = current.status();
        boolean fieldsChanged = !current.title().equals(after.title())
                || !trim(current.description()).equals(after.description())
                || current.priority() != after.priority();
        boolean statusChanged = oldStatus != after.status();
        if (!fieldsChanged && !statusChanged)
            return;

        Instant now = ctx.now();
        TaskCard updated = new TaskCard(current.id(), after.title(), after.description(), oldStatus,
                after.priority(), current.assignedAgentId(), current.createdAt(), now, current.completedAt());
        if (statusChanged)
            updated = updated.withStatus(after.status(), now);

        if (!ctx.tx().updateCard(updated)) {
            ctx.error("Kanban update ignored for " + after.id() + ": card not owned by this agent.");
            return;
        }
        ctx.updated(current.id());
        RecordChange.Action action = statusChanged ? statusAction(after.status()) : RecordChange.Action.UPDATED;
        ctx.change(new RecordChange(current.id(), after.title(), action, oldStatus, after.status()));
    }

    static RecordChange.Action statusAction(TaskStatus newStatus) {
        return switch (newStatus) {
            case DONE -> RecordChange.Action.COMPLETED;
            case DOING -> RecordChange.Action.STARTED;
            case TODO -> RecordChange.Action.UPDATED;
        };
    }

    @Override
    protected void remove(CardRow row, ApplyContext ctx) {
        if (!ctx.tx().deleteCard(ctx.agentId(), row.id()))
            return;
        ctx.removed(row.id());
        RecordChange.Action action = row.status().isTerminal()
                ? RecordChange.Action.ARCHIVED
                : RecordChange.Action.DELETED;
        ctx.change(new RecordChange(row.id(), row.title(), action, row.status(), null));
    }

    // =====================================================================
    // Board
    // =====================================================================

    /** Board of the cards assigned to the agent, as stored right now. */
    public TaskBoardSnapshot snapshot(RecordStore store, String agentId) {
        return TaskBoardSnapshot.of(store.findAssignedCards(agentId));
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
