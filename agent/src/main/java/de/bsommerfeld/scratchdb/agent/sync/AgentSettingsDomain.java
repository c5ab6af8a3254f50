package de.bsommerfeld.scratchdb.agent.sync;

import com.google.inject.Singleton;
import de.bsommerfeld.scratchdb.core.domain.AgentIdentity;
import de.bsommerfeld.scratchdb.core.domain.AgentSettings;
import de.bsommerfeld.scratchdb.db.SqlLoader;
import de.bsommerfeld.scratchdb.db.schema.BuiltinTables;
import de.bsommerfeld.scratchdb.db.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Agent configuration mirrored as the single-row {@code __agent_config}
 * table. Charter and schedule are validated independently: a bad schedule
 * does not block a good charter edit. Deleting the row changes nothing.
 */
@Singleton
public class AgentSettingsDomain extends RowwiseMirrorDomain<AgentSettings, AgentSettings> {

    private static final Logger LOG = LoggerFactory.getLogger(AgentSettingsDomain.class);

    public static final String NAME = "agent_config";
    static final String ROW_ID = "1";
    static final int MAX_CHARTER_LENGTH = 10_000;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String table() {
        return BuiltinTables.AGENT_CONFIG;
    }

    @Override
    public String createTableSql(AgentIdentity agent) {
        return SqlLoader.load("create-config-mirror");
    }

    @Override
    public List<AgentSettings> load(RecordStore store, AgentIdentity agent) {
        return List.of(store.findSettings(agent.agentId()));
    }

    @Override
    public String insertSql() {
        return SqlLoader.load("insert-config-mirror");
    }

    @Override
    public void bindInsert(PreparedStatement ps, AgentSettings settings) throws SQLException {
        AgentSettings row = toRow(settings);
        ps.setString(1, row.charter());
        ps.setString(2, row.schedule());
    }

    @Override
    public AgentSettings toRow(AgentSettings settings) {
        return new AgentSettings(normalizeCharter(settings.charter()), normalizeSchedule(settings.schedule()));
    }

    @Override
    public String idOf(AgentSettings row) {
        return ROW_ID;
    }

    @Override
    public String selectSql() {
        return SqlLoader.load("select-config-mirror");
    }

    @Override
    public void parseRow(ResultSet rs, AgentIdentity agent, RowParse<AgentSettings> parse) throws SQLException {
        parse.accept(ROW_ID, new AgentSettings(normalizeCharter(rs.getString("charter")),
                normalizeSchedule(rs.getString("schedule"))));
    }

    static String normalizeCharter(String value) {
        return value == null ? "" : value.trim();
    }

    static String normalizeSchedule(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    // =====================================================================
    // Apply
    // =====================================================================

    @Override
    protected String label() {
        return "Config";
    }

    @Override
    protected String recordNoun() {
        return "settings";
    }

    @Override
    protected String ownerField() {
        return "id";
    }

    @Override
    protected boolean isOwnedBy(AgentSettings row, String agentId) {
        return true;
    }

    @Override
    protected void create(AgentSettings row, ApplyContext ctx) {
        update(AgentSettings.empty(), row, ctx);
    }

    @Override
    protected void update(AgentSettings before, AgentSettings after, ApplyContext ctx) {
        String charter = before.charter();
        String schedule = before.schedule();
        boolean charterChanged = false;
        boolean scheduleChanged = false;

        if (!after.charter().equals(before.charter())) {
            Optional<String> invalid = validateCharter(after.charter());
            if (invalid.isPresent()) {
                ctx.error("Charter update failed: " + invalid.get());
            } else {
                charter = after.charter();
                charterChanged = true;
            }
        }

        if (!Objects.equals(after.schedule(), before.schedule())) {
            Optional<String> invalid = after.schedule() == null
                    ? Optional.empty()
                    : ScheduleExpressions.validate(after.schedule());
            if (invalid.isPresent()) {
                ctx.error("Invalid schedule format: " + invalid.get());
            } else {
                schedule = after.schedule();
                scheduleChanged = true;
            }
        }

        if (!charterChanged && !scheduleChanged)
            return;

        ctx.tx().saveSettings(ctx.agentId(), new AgentSettings(charter, schedule));
        if (charterChanged)
            ctx.updated("charter");
        if (scheduleChanged) {
            ctx.updated("schedule");
            LOG.info("Agent {} schedule changed from '{}' to '{}'", ctx.agentId(),
                    before.schedule() == null ? "None" : before.schedule(), schedule == null ? "None" : schedule);
        }
    }

    static Optional<String> validateCharter(String charter) {
        if (charter.isEmpty())
            return Optional.of("charter cannot be empty.");
        if (charter.length() > MAX_CHARTER_LENGTH)
            return Optional.of("charter exceeds " + MAX_CHARTER_LENGTH + " characters.");
        return Optional.empty();
    }

    @Override
    protected void remove(AgentSettings row, ApplyContext ctx) {
        LOG.debug("Agent {} deleted its {} row; settings left unchanged", ctx.agentId(), BuiltinTables.AGENT_CONFIG);
    }
}
