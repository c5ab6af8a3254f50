package de.bsommerfeld.scratchdb.db.exec;

import de.bsommerfeld.scratchdb.db.guard.SqlLexer;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rewrites for statements the agent commonly writes in another dialect's
 * shape. Only attempted after a syntax error.
 *
 * <p>
 * Currently one rewrite: {@code WITH x AS (...) CREATE TABLE t AS SELECT ...}
 * becomes {@code CREATE TABLE t AS WITH x AS (...) SELECT ...}.
 */
final class SqlAutocorrect {

    static final String MOVED_WITH_CLAUSE = "moved WITH clause after CREATE TABLE/VIEW AS";

    private static final Pattern CREATE_AS_TARGET = Pattern.compile(
            "\\bCREATE\\s+(?:(?:TEMP|TEMPORARY)\\s+)?(?:TABLE|VIEW)\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** A rewritten statement and the fix it applied. */
    record Rewrite(String sql, String fix) {
    }

    private SqlAutocorrect() {
    }

    static Optional<Rewrite> suggest(String sql, String errorMessage) {
        if (sql == null || !ErrorHints.isSyntaxError(errorMessage))
            return Optional.empty();
        return moveWithClause(sql)
                .filter(rewrite -> !normalize(rewrite.sql()).equals(normalize(sql)));
    }

    static Optional<Rewrite> moveWithClause(String sql) {
        String cleaned = SqlLexer.mask(sql);
        if (!cleaned.stripLeading().toUpperCase(Locale.ROOT).startsWith("WITH"))
            return Optional.empty();

        int createIdx = findTopLevelKeyword(cleaned, "CREATE", 0);
        if (createIdx < 0)
            return Optional.empty();
        int asIdx = findTopLevelKeyword(cleaned, "AS", createIdx);
        if (asIdx < 0 || findTopLevelKeyword(cleaned, "SELECT", asIdx) < 0)
            return Optional.empty();
        if (!CREATE_AS_TARGET.matcher(cleaned.substring(createIdx, asIdx).toUpperCase(Locale.ROOT)).find())
            return Optional.empty();

        String withClause = sql.substring(0, createIdx).strip();
        String createPrefix = sql.substring(createIdx, asIdx).stripTrailing();
        String selectSuffix = sql.substring(asIdx + 2).stripLeading();
        if (withClause.isEmpty() || createPrefix.isEmpty() || selectSuffix.isEmpty())
            return Optional.empty();

        return Optional.of(new Rewrite(createPrefix + " AS " + withClause + " " + selectSuffix, MOVED_WITH_CLAUSE));
    }

    /**
     * First occurrence of {@code keyword} at parenthesis depth zero with no
     * identifier character on either side, or -1.
     */
    static int findTopLevelKeyword(String cleaned, String keyword, int start) {
        int length = cleaned.length();
        int depth = 0;
        for (int idx = start; idx < length; idx++) {
            char ch = cleaned.charAt(idx);
            if (ch == '(') {
                depth++;
            } else if (ch == ')' && depth > 0) {
                depth--;
            }
            if (depth == 0 && cleaned.regionMatches(true, idx, keyword, 0, keyword.length())) {
                char before = idx > 0 ? cleaned.charAt(idx - 1) : ' ';
                int afterIdx = idx + keyword.length();
                char after = afterIdx < length ? cleaned.charAt(afterIdx) : ' ';
                if (!isIdentifierChar(before) && !isIdentifierChar(after))
                    return idx;
            }
        }
        return -1;
    }

    private static boolean isIdentifierChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }

    static String normalize(String sql) {
        String collapsed = WHITESPACE.matcher(sql.strip()).replaceAll(" ");
        while (collapsed.endsWith(";"))
            collapsed = collapsed.substring(0, collapsed.length() - 1);
        return collapsed;
    }
}
