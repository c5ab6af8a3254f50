package de.bsommerfeld.scratchdb.db.schema;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tables the system itself creates inside a scratch database. All of them
 * are ephemeral: they are recreated every cycle and dropped before the
 * database is persisted.
 */
public final class BuiltinTables {

    public static final String TOOL_RESULTS = "__tool_results";
    public static final String AGENT_CONFIG = "__agent_config";
    public static final String KANBAN_CARDS = "__kanban_cards";
    public static final String AGENT_SKILLS = "__agent_skills";

    public static final Set<String> EPHEMERAL = Set.of(TOOL_RESULTS, AGENT_CONFIG, KANBAN_CARDS, AGENT_SKILLS);

    private static final Map<String, String> NOTES = Map.of(
            TOOL_RESULTS, "built-in, ephemeral (dropped before persistence)",
            AGENT_CONFIG, "built-in, ephemeral (reset every cycle; charter/schedule updates)",
            KANBAN_CARDS, "built-in, ephemeral (syncs to kanban cards after tool execution)",
            AGENT_SKILLS, "built-in, ephemeral (versioned skill mirror synced to persistent storage after tool execution)");

    private BuiltinTables() {
    }

    public static boolean isEphemeral(String table) {
        return EPHEMERAL.contains(table);
    }

    /** Short description shown next to a built-in table in the schema summary. */
    public static Optional<String> note(String table) {
        return Optional.ofNullable(NOTES.get(table));
    }

    /** Double-quoted identifier with embedded quotes doubled. */
    public static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
