package de.bsommerfeld.scratchdb.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Classpath SQL for the durable record store, the schema tools and the
 * agent's mirror tables.
 *
 * <p>
 * Single statements live under {@code sql/} in whichever module owns them:
 * the record store and schema queries in {@code database}, the mirror and
 * tool-result DDL in {@code agent}. Both directories share one classpath
 * namespace, so a name must be unique across modules. Names follow
 * {@code <operation>-<entity>}, e.g. {@code select-visible-cards},
 * {@code create-kanban-mirror}.
 *
 * <p>
 * Multi-statement scripts such as {@code schema.sql} sit at the classpath
 * root and are read with {@link #script(String)}.
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> STATEMENTS = new ConcurrentHashMap<>();
    private static final ConcurrentHashMap<String, List<String>> SCRIPTS = new ConcurrentHashMap<>();

    /** A semicolon that ends its line. Semicolons inside a line are left alone. */
    private static final Pattern STATEMENT_END = Pattern.compile(";\\s*(\\r?\\n|$)");

    private SqlLoader() {
    }

    /**
     * Returns the trimmed statement in {@code sql/<name>.sql}.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return STATEMENTS.computeIfAbsent(name, n -> read("sql/" + n + ".sql").trim());
    }

    /**
     * Returns the statements of a script resource in file order, with
     * {@code --} comment lines removed and blank statements skipped.
     *
     * @param resource classpath path, e.g. {@code schema.sql}
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static List<String> script(String resource) {
        return SCRIPTS.computeIfAbsent(resource, r -> splitScript(read(r)));
    }

    static List<String> splitScript(String text) {
        List<String> statements = new ArrayList<>();
        for (String chunk : STATEMENT_END.split(text)) {
            StringBuilder sb = new StringBuilder();
            for (String line : chunk.split("\\r?\\n")) {
                if (!line.trim().startsWith("--"))
                    sb.append(line).append('\n');
            }
            String statement = sb.toString().trim();
            if (!statement.isEmpty())
                statements.add(statement);
        }
        return List.copyOf(statements);
    }

    private static String read(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null)
                throw new IllegalStateException("SQL resource not found: " + path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
