package de.bsommerfeld.scratchdb.db.guard;

import de.bsommerfeld.scratchdb.db.guard.SqlLexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Compile-time gate in front of {@link java.sql.Connection#prepareStatement}.
 *
 * <p>
 * The JDBC driver exposes no authorizer callback, so the deny-lists of a
 * {@link SandboxPolicy} are enforced on the token stream of each statement
 * before the engine sees it:
 * <ul>
 * <li>a statement whose first keyword (after {@code EXPLAIN [QUERY PLAN]})
 * is a blocked action such as {@code ATTACH}</li>
 * <li>a call of a blocked function, quoted or not</li>
 * <li>a {@code PRAGMA [schema.]name} statement naming a blocked pragma, and
 * the {@code pragma_<name>} table-valued form anywhere</li>
 * </ul>
 * Names that are followed by a parenthesis but are not calls (table
 * definitions, insert column lists, CTE names) are recognized by their
 * preceding keyword or by the {@code AS} that follows their column list.
 */
public final class StatementAuthorizer {

    private static final Logger LOG = LoggerFactory.getLogger(StatementAuthorizer.class);

    private static final Set<String> NON_CALL_PREDECESSORS = Set.of(
            "TABLE", "EXISTS", "INTO", "VIEW", "INDEX", "REFERENCES", "ON", "JOIN", "FROM", "UPDATE", "TRIGGER");

    private final SandboxPolicy policy;

    public StatementAuthorizer(SandboxPolicy policy) {
        this.policy = policy;
    }

    /**
     * @return the denial reason, or empty when the text may be prepared
     */
    public Optional<String> check(String sql) {
        List<Token> tokens = SqlLexer.tokenize(sql);
        boolean atStatementStart = true;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isSymbol(';')) {
                atStatementStart = true;
                continue;
            }
            if (atStatementStart) {
                atStatementStart = false;
                int first = skipExplain(tokens, i);
                Optional<String> denial = checkStatementHead(tokens, first);
                if (denial.isPresent())
                    return denial;
            }
            if (!token.isName())
                continue;

            String name = token.lower();
            if (name.startsWith("pragma_") && policy.isPragmaBlocked(name.substring("pragma_".length()))) {
                return deny("PRAGMA " + name.substring("pragma_".length()));
            }
            if (isCall(tokens, i) && policy.isFunctionBlocked(name)) {
                return deny("function " + name + "()");
            }
        }
        return Optional.empty();
    }

    private Optional<String> checkStatementHead(List<Token> tokens, int first) {
        if (first >= tokens.size())
            return Optional.empty();
        Token head = tokens.get(first);
        if (head.kind() != SqlLexer.Kind.WORD)
            return Optional.empty();
        if (policy.isActionBlocked(head.lower()))
            return deny(head.text().toUpperCase(Locale.ROOT));
        if (head.isWord("PRAGMA")) {
            int nameIdx = first + 1;
            if (nameIdx + 2 < tokens.size() && tokens.get(nameIdx + 1).isSymbol('.'))
                nameIdx += 2;
            if (nameIdx < tokens.size() && tokens.get(nameIdx).isName()
                    && policy.isPragmaBlocked(tokens.get(nameIdx).lower())) {
                return deny("PRAGMA " + tokens.get(nameIdx).lower());
            }
        }
        return Optional.empty();
    }

    private static int skipExplain(List<Token> tokens, int idx) {
        if (idx < tokens.size() && tokens.get(idx).isWord("EXPLAIN")) {
            idx++;
            if (idx + 1 < tokens.size() && tokens.get(idx).isWord("QUERY") && tokens.get(idx + 1).isWord("PLAN"))
                idx += 2;
        }
        return idx;
    }

    private static boolean isCall(List<Token> tokens, int idx) {
        if (idx + 1 >= tokens.size() || !tokens.get(idx + 1).isSymbol('('))
            return false;
        int previousIdx = idx - 1;
        // schema.name(...) is judged by what precedes the schema
        if (previousIdx >= 2 && tokens.get(previousIdx).isSymbol('.'))
            previousIdx -= 2;
        if (previousIdx >= 0) {
            Token previous = tokens.get(previousIdx);
            if (previous.kind() == SqlLexer.Kind.WORD
                    && NON_CALL_PREDECESSORS.contains(previous.text().toUpperCase(Locale.ROOT))) {
                return false;
            }
        }
        return !isCteColumnList(tokens, idx + 1);
    }

    /** {@code name(cols) AS (...)}, possibly with [NOT] MATERIALIZED. */
    private static boolean isCteColumnList(List<Token> tokens, int openIdx) {
        int depth = 0;
        for (int i = openIdx; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isSymbol('(')) {
                depth++;
            } else if (t.isSymbol(')')) {
                depth--;
                if (depth == 0) {
                    if (i + 2 >= tokens.size() || !tokens.get(i + 1).isWord("AS"))
                        return false;
                    Token next = tokens.get(i + 2);
                    return next.isSymbol('(') || next.isWord("MATERIALIZED") || next.isWord("NOT");
                }
            }
        }
        return false;
    }

    private static Optional<String> deny(String what) {
        LOG.warn("Blocked SQLite access to {}", what);
        return Optional.of("Access denied: " + what + " is not permitted in the sandbox.");
    }
}
