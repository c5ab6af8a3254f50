package de.bsommerfeld.scratchdb.db.guard;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical statement classification and splitting. No parse tree is built;
 * every decision is made on {@link SqlLexer#mask(String) masked} text so
 * keywords inside literals or comments never count.
 *
 * <h3>Write detection</h3>
 * A statement is a write when its first keyword, after an optional leading
 * {@code WITH} clause, is one of INSERT, UPDATE, DELETE, REPLACE, CREATE,
 * ALTER or DROP and it has no {@code RETURNING} clause. When the
 * {@code WITH} clause cannot be skipped the statement counts as a read: a
 * wrong "read" only costs another turn, a wrong "write" may end the cycle
 * with rows nobody inspected.
 *
 * <h3>Splitting</h3>
 * {@link #split(String)} cuts on {@code ;} outside comments, literals and
 * quoted identifiers, and keeps a {@code CREATE TRIGGER ... BEGIN ... END}
 * body in one piece.
 */
public final class StatementClassifier {

    private static final Set<String> WRITE_KEYWORDS = Set.of(
            "INSERT", "UPDATE", "DELETE", "REPLACE", "CREATE", "ALTER", "DROP");

    private static final Pattern LEADING_WORD = Pattern.compile("^([A-Z]+)");
    private static final Pattern RETURNING = Pattern.compile("\\bRETURNING\\b");

    private final SandboxPolicy policy;

    public StatementClassifier() {
        this(DefaultSandboxPolicy.instance());
    }

    public StatementClassifier(SandboxPolicy policy) {
        this.policy = policy;
    }

    public Classification classify(String sql) {
        Optional<String> reason = blockReason(sql);
        if (reason.isPresent())
            return Classification.blocked(reason.get());
        return isWrite(sql) ? Classification.write() : Classification.read();
    }

    /**
     * Lexical guard over every statement in {@code sql}. Callers must refuse
     * to execute anything when this returns a reason.
     */
    public Optional<String> blockReason(String sql) {
        if (sql == null || sql.isBlank())
            return Optional.empty();
        for (String statement : split(sql)) {
            Optional<String> reason = policy.blockedShape(SqlLexer.mask(statement));
            if (reason.isPresent())
                return reason;
        }
        return Optional.empty();
    }

    public boolean isWrite(String sql) {
        if (sql == null)
            return false;
        String upper = SqlLexer.mask(sql).strip().toUpperCase(Locale.ROOT);
        if (upper.isEmpty())
            return false;

        if (upper.startsWith("WITH")) {
            String remainder = skipLeadingWith(upper);
            if (remainder == null)
                return false;
            upper = remainder.strip();
        }

        Matcher m = LEADING_WORD.matcher(upper);
        if (!m.find() || !WRITE_KEYWORDS.contains(m.group(1)))
            return false;
        return !RETURNING.matcher(upper).find();
    }

    /**
     * Removes a leading {@code WITH [RECURSIVE] name [(cols)] AS [NOT]
     * [MATERIALIZED] (...) [, ...]} prefix from upper-cased masked text.
     *
     * @return the text after the clause, or {@code null} when it cannot be
     *         skipped
     */
    static String skipLeadingWith(String upper) {
        int length = upper.length();
        int idx = 4;
        if (length > idx && SqlLexer.isWordPart(upper.charAt(idx)))
            return null;
        idx = skipSpaces(upper, idx);
        if (startsWithWord(upper, idx, "RECURSIVE"))
            idx = skipSpaces(upper, idx + "RECURSIVE".length());

        int depth = 0;
        boolean sawParen = false;
        boolean cteFinished = false;
        while (idx < length) {
            char ch = upper.charAt(idx);
            if (depth == 0 && cteFinished) {
                if (Character.isWhitespace(ch)) {
                    idx++;
                    continue;
                }
                if (ch == ',') {
                    cteFinished = false;
                    sawParen = false;
                    idx++;
                    continue;
                }
                // A column list was closed, the body is still ahead
                String word = wordAt(upper, idx);
                if (word.equals("AS") || word.equals("NOT") || word.equals("MATERIALIZED")) {
                    cteFinished = false;
                    sawParen = false;
                    idx += word.length();
                    continue;
                }
                return upper.substring(idx);
            }
            if (ch == '(') {
                depth++;
                sawParen = true;
            } else if (ch == ')') {
                if (depth > 0)
                    depth--;
                if (depth == 0 && sawParen)
                    cteFinished = true;
            }
            idx++;
        }
        return null;
    }

    /**
     * Splits text into individual statements without their terminating
     * semicolons. Blank and comment-only pieces are dropped.
     */
    public List<String> split(String sqlText) {
        List<String> statements = new ArrayList<>();
        if (sqlText == null || sqlText.isEmpty())
            return statements;

        String masked = SqlLexer.mask(sqlText);
        String upper = masked.toUpperCase(Locale.ROOT);
        int length = masked.length();

        int start = 0;
        int wordIndex = 0;
        boolean trigger = false;
        int beginDepth = 0;
        int caseDepth = 0;

        int i = 0;
        while (i < length) {
            char ch = masked.charAt(i);
            if (ch == '`') {
                i = SqlLexer.quotedEnd(sqlText, i, '`');
                continue;
            }
            if (ch == '[') {
                int close = sqlText.indexOf(']', i + 1);
                i = close < 0 ? length : close + 1;
                continue;
            }
            if (Character.isLetter(ch) || ch == '_') {
                int end = i + 1;
                while (end < length && SqlLexer.isWordPart(masked.charAt(end)))
                    end++;
                String word = upper.substring(i, end);
                if (wordIndex < 4 && word.equals("TRIGGER") && firstWordIsCreate(upper, start))
                    trigger = true;
                if (trigger) {
                    switch (word) {
                        case "BEGIN" -> beginDepth++;
                        case "CASE" -> caseDepth++;
                        case "END" -> {
                            if (caseDepth > 0)
                                caseDepth--;
                            else if (beginDepth > 0)
                                beginDepth--;
                        }
                        default -> {
                        }
                    }
                }
                wordIndex++;
                i = end;
                continue;
            }
            if (ch == ';' && beginDepth == 0) {
                addStatement(statements, sqlText, masked, start, i);
                start = i + 1;
                wordIndex = 0;
                trigger = false;
                caseDepth = 0;
            }
            i++;
        }
        addStatement(statements, sqlText, masked, start, length);
        return statements;
    }

    private static void addStatement(List<String> out, String original, String masked, int from, int to) {
        if (from >= to || masked.substring(from, to).isBlank())
            return;
        out.add(original.substring(from, to).strip());
    }

    private static boolean firstWordIsCreate(String upper, int statementStart) {
        int idx = skipSpaces(upper, statementStart);
        return startsWithWord(upper, idx, "CREATE");
    }

    private static int skipSpaces(String text, int idx) {
        while (idx < text.length() && Character.isWhitespace(text.charAt(idx)))
            idx++;
        return idx;
    }

    private static boolean startsWithWord(String text, int idx, String word) {
        if (!text.startsWith(word, idx))
            return false;
        int after = idx + word.length();
        return after >= text.length() || !SqlLexer.isWordPart(text.charAt(after));
    }

    private static String wordAt(String text, int idx) {
        int end = idx;
        while (end < text.length() && SqlLexer.isWordPart(text.charAt(end)))
            end++;
        return text.substring(idx, end);
    }
}
