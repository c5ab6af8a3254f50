package de.bsommerfeld.scratchdb.agent.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.scratchdb.core.domain.AgentIdentity;
import de.bsommerfeld.scratchdb.core.domain.Skill;
import de.bsommerfeld.scratchdb.core.util.Identifiers;
import de.bsommerfeld.scratchdb.db.SqlLoader;
import de.bsommerfeld.scratchdb.db.schema.BuiltinTables;
import de.bsommerfeld.scratchdb.db.store.RecordStore;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Skill library mirrored as {@code __agent_skills}, every stored version one
 * row. Skills are versioned by name:
 * <ul>
 * <li>an edited or inserted row becomes the candidate for its name (the last
 * one in table order wins)</li>
 * <li>a candidate equal to the latest stored version is skipped, otherwise
 * it is stored as version {@code latest + 1}</li>
 * <li>a name with no rows left deletes every stored version</li>
 * <li>a candidate referencing a tool id outside the {@link ToolCatalog} is
 * rejected as a whole</li>
 * </ul>
 * A malformed row keeps its name alive, so a bad edit never deletes a skill.
 */
@Singleton
public class SkillDomain implements MirrorDomain<Skill, SkillDomain.SkillRow> {

    public static final String NAME = "skills";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ToolCatalog toolCatalog;

    /** Comparable content of one skill row. */
    public record SkillRow(String id, String name, String description, List<String> tools, String instructions) {

        public SkillRow {
            tools = List.copyOf(tools);
        }
    }

    @Inject
    public SkillDomain(ToolCatalog toolCatalog) {
        this.toolCatalog = toolCatalog;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String table() {
        return BuiltinTables.AGENT_SKILLS;
    }

    @Override
    public String createTableSql(AgentIdentity agent) {
        return SqlLoader.load("create-skills-mirror");
    }

    @Override
    public List<Skill> load(RecordStore store, AgentIdentity agent) {
        return store.findSkills(agent.agentId());
    }

    @Override
    public String insertSql() {
        return SqlLoader.load("insert-skills-mirror");
    }

    @Override
    public void bindInsert(PreparedStatement ps, Skill skill) throws SQLException {
        SkillRow row = toRow(skill);
        ps.setString(1, row.id());
        ps.setString(2, row.name());
        ps.setString(3, row.description());
        ps.setInt(4, skill.version());
        ps.setString(5, writeTools(row.tools()));
        ps.setString(6, row.instructions());
        setTimestamp(ps, 7, skill.createdAt());
        setTimestamp(ps, 8, skill.updatedAt());
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value.toString());
        }
    }

    @Override
    public SkillRow toRow(Skill skill) {
        return new SkillRow(skill.id(), trim(skill.name()), trim(skill.description()),
                normalizeTools(skill.tools()), trim(skill.instructions()));
    }

    @Override
    public String idOf(SkillRow row) {
        return row.id();
    }

    @Override
    public String selectSql() {
        return SqlLoader.load("select-skills-mirror");
    }

    @Override
    public void parseRow(ResultSet rs, AgentIdentity agent, RowParse<SkillRow> parse) throws SQLException {
        String id = trim(rs.getString("id"));
        String name = trim(rs.getString("name"));
        if (id.isEmpty()) {
            parse.reject("Skill row ignored: missing id.");
            if (!name.isEmpty())
                parse.protectName(name);
            return;
        }
        if (name.isEmpty()) {
            parse.protect(id, "Skill row " + id + " ignored: name is required.");
            return;
        }

        List<String> tools = new ArrayList<>();
        Optional<String> toolsError = parseTools(rs.getString("tools"), tools);
        if (toolsError.isPresent()) {
            parse.protect(id, "Skill '" + name + "' ignored: " + toolsError.get());
            parse.protectName(name);
            return;
        }

        parse.accept(id, new SkillRow(id, name, trim(rs.getString("description")), tools,
                trim(rs.getString("instructions"))));
    }

    /**
     * Parses a mirror {@code tools} cell into {@code out}.
     *
     * @return the error message when the cell is not a JSON array of
     *         non-blank strings
     */
    static Optional<String> parseTools(String raw, List<String> out) {
        if (raw == null || raw.isBlank())
            return Optional.empty();

        JsonNode node;
        try {
            node = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            return Optional.of("tools must be a JSON array of canonical tool IDs");
        }
        if (node == null || !node.isArray())
            return Optional.of("tools must be a JSON array");

        Set<String> seen = new LinkedHashSet<>();
        for (JsonNode entry : node) {
            if (!entry.isTextual())
                return Optional.of("tools entries must be strings");
            String toolId = entry.asText().trim();
            if (toolId.isEmpty())
                return Optional.of("tools entries cannot be empty");
            seen.add(toolId);
        }
        out.addAll(seen);
        return Optional.empty();
    }

    static List<String> normalizeTools(List<String> tools) {
        Set<String> seen = new LinkedHashSet<>();
        for (String tool : tools) {
            if (tool != null && !tool.isBlank())
                seen.add(tool.trim());
        }
        return new ArrayList<>(seen);
    }

    private static String writeTools(List<String> tools) throws SQLException {
        try {
            return MAPPER.writeValueAsString(tools);
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to serialize skill tools", e);
        }
    }

    // =====================================================================
    // Apply
    // =====================================================================

    @Override
    public void apply(MirrorDiff<SkillRow> diff, ApplyContext ctx) {
        Set<String> currentNames = new TreeSet<>(diff.protectedNames());
        for (SkillRow row : diff.current().values())
            currentNames.add(row.name());
        for (String protectedId : diff.protectedIds()) {
            SkillRow original = diff.baseline().get(protectedId);
            if (original != null)
                currentNames.add(original.name());
        }

        Set<String> deletedNames = new TreeSet<>();
        for (SkillRow row : diff.baseline().values()) {
            if (!currentNames.contains(row.name()))
                deletedNames.add(row.name());
        }

        Map<String, SkillRow> candidates = new LinkedHashMap<>();
        for (SkillRow row : diff.current().values()) {
            SkillRow original = diff.baseline().get(row.id());
            if (row.equals(original))
                continue;
            candidates.put(row.name(), row);
        }

        for (String name : deletedNames) {
            ctx.tx().deleteSkills(ctx.agentId(), name);
            ctx.removed(name);
        }

        Set<String> validToolIds = toolCatalog.availableToolIds(ctx.agent());
        for (SkillRow row : candidates.values())
            applyCandidate(row, validToolIds, ctx);
    }

    private void applyCandidate(SkillRow row, Set<String> validToolIds, ApplyContext ctx) {
        List<String> unknown = new ArrayList<>();
        for (String toolId : row.tools()) {
            if (!validToolIds.contains(toolId))
                unknown.add(toolId);
        }
        if (!unknown.isEmpty()) {
            ctx.error("Skill '" + row.name() + "' rejected: unknown canonical tool id(s): " + String.join(", ", unknown));
            return;
        }

        Optional<Skill> latest = ctx.tx().findLatestSkill(ctx.agentId(), row.name());
        if (latest.isPresent() && sameContent(latest.get(), row))
            return;

        int nextVersion = latest.map(Skill::version).orElse(0) + 1;
        Instant now = ctx.now();
        ctx.tx().insertSkill(new Skill(Identifiers.newId(), ctx.agentId(), row.name(), row.description(),
                nextVersion, row.tools(), row.instructions(), now, now));
        ctx.created(row.name() + "@" + nextVersion);
    }

    private static boolean sameContent(Skill skill, SkillRow row) {
        return trim(skill.description()).equals(row.description())
                && normalizeTools(skill.tools()).equals(row.tools())
                && trim(skill.instructions()).equals(row.instructions());
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
