package de.bsommerfeld.scratchdb.db.guard;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The deny-lists every scratch database session runs with.
 */
public final class DefaultSandboxPolicy implements SandboxPolicy {

    public static final String VACUUM_REASON = "VACUUM statements are disabled for safety.";

    private static final Set<String> BLOCKED_ACTIONS = Set.of("attach", "detach");

    private static final Set<String> BLOCKED_FUNCTIONS = Set.of(
            "load_extension",
            "readfile",
            "writefile",
            "edit",
            "fts3_tokenizer");

    private static final Set<String> BLOCKED_PRAGMAS = Set.of(
            "database_list",
            "key",
            "rekey",
            "temp_store",
            "temp_store_directory");

    private static final Pattern VACUUM = Pattern.compile(
            "^\\s*(?:EXPLAIN\\s+(?:QUERY\\s+PLAN\\s+)?)?VACUUM\\b",
            Pattern.CASE_INSENSITIVE);

    private static final DefaultSandboxPolicy INSTANCE = new DefaultSandboxPolicy();

    private DefaultSandboxPolicy() {
    }

    public static DefaultSandboxPolicy instance() {
        return INSTANCE;
    }

    @Override
    public boolean isActionBlocked(String action) {
        return action != null && BLOCKED_ACTIONS.contains(action.toLowerCase(Locale.ROOT));
    }

    @Override
    public boolean isFunctionBlocked(String function) {
        return function != null && BLOCKED_FUNCTIONS.contains(function.toLowerCase(Locale.ROOT));
    }

    @Override
    public boolean isPragmaBlocked(String pragma) {
        return pragma != null && BLOCKED_PRAGMAS.contains(pragma.toLowerCase(Locale.ROOT));
    }

    @Override
    public Optional<String> blockedShape(String maskedSql) {
        if (maskedSql != null && VACUUM.matcher(maskedSql).find()) {
            return Optional.of(VACUUM_REASON);
        }
        return Optional.empty();
    }
}
