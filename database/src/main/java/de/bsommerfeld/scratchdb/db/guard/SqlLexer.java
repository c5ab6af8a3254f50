package de.bsommerfeld.scratchdb.db.guard;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Minimal SQL scanner shared by the classifier, the splitter, the gate and
 * the autocorrect rewrite. It understands comments, quoted literals and
 * quoted identifiers, nothing more.
 *
 * <h3>Masking</h3>
 * {@link #mask(String)} returns a copy of the input of the <em>same
 * length</em> in which comments and the contents of {@code '...'} and
 * {@code "..."} literals (quotes included) are replaced with spaces. Offsets
 * found in the masked text are valid offsets into the original, so callers
 * can search the mask and cut the original.
 *
 * <h3>Tokens</h3>
 * {@link #tokenize(String)} yields words, quoted identifiers (unquoted),
 * string literals, numbers and single-character symbols. Whitespace and
 * comments are dropped.
 */
public final class SqlLexer {

    public enum Kind {
        WORD, IDENTIFIER, STRING, NUMBER, SYMBOL
    }

    /**
     * One lexical token. {@code text} is the unquoted value for
     * {@link Kind#IDENTIFIER} and {@link Kind#STRING}, the raw text otherwise.
     */
    public record Token(Kind kind, String text, int start, int end) {

        public boolean isWord(String keyword) {
            return kind == Kind.WORD && text.equalsIgnoreCase(keyword);
        }

        public boolean isSymbol(char c) {
            return kind == Kind.SYMBOL && text.length() == 1 && text.charAt(0) == c;
        }

        /** Words and quoted identifiers both name things. */
        public boolean isName() {
            return kind == Kind.WORD || kind == Kind.IDENTIFIER;
        }

        public String lower() {
            return text.toLowerCase(Locale.ROOT);
        }
    }

    private SqlLexer() {
    }

    public static String mask(String sql) {
        if (sql == null)
            return "";
        char[] out = sql.toCharArray();
        int length = out.length;
        int i = 0;
        while (i < length) {
            char ch = sql.charAt(i);
            if (ch == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
                int end = lineCommentEnd(sql, i);
                blank(out, i, end);
                i = end;
            } else if (ch == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
                int end = blockCommentEnd(sql, i);
                blank(out, i, end);
                i = end;
            } else if (ch == '\'' || ch == '"') {
                int end = quotedEnd(sql, i, ch);
                blank(out, i, end);
                i = end;
            } else {
                i++;
            }
        }
        return new String(out);
    }

    public static List<Token> tokenize(String sql) {
        List<Token> tokens = new ArrayList<>();
        if (sql == null)
            return tokens;
        int length = sql.length();
        int i = 0;
        while (i < length) {
            char ch = sql.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
            } else if (ch == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
                i = lineCommentEnd(sql, i);
            } else if (ch == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
                i = blockCommentEnd(sql, i);
            } else if (ch == '\'') {
                int end = quotedEnd(sql, i, '\'');
                tokens.add(new Token(Kind.STRING, unquote(sql, i, end, '\''), i, end));
                i = end;
            } else if (ch == '"' || ch == '`') {
                int end = quotedEnd(sql, i, ch);
                tokens.add(new Token(Kind.IDENTIFIER, unquote(sql, i, end, ch), i, end));
                i = end;
            } else if (ch == '[') {
                int close = sql.indexOf(']', i + 1);
                int end = close < 0 ? length : close + 1;
                String inner = sql.substring(i + 1, close < 0 ? length : close);
                tokens.add(new Token(Kind.IDENTIFIER, inner, i, end));
                i = end;
            } else if (isWordStart(ch)) {
                int end = i + 1;
                while (end < length && isWordPart(sql.charAt(end)))
                    end++;
                tokens.add(new Token(Kind.WORD, sql.substring(i, end), i, end));
                i = end;
            } else if (Character.isDigit(ch)) {
                int end = i + 1;
                while (end < length && (Character.isLetterOrDigit(sql.charAt(end)) || sql.charAt(end) == '.'))
                    end++;
                tokens.add(new Token(Kind.NUMBER, sql.substring(i, end), i, end));
                i = end;
            } else {
                tokens.add(new Token(Kind.SYMBOL, String.valueOf(ch), i, i + 1));
                i++;
            }
        }
        return tokens;
    }

    /** True for characters that can continue an unquoted identifier. */
    public static boolean isWordPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$';
    }

    private static boolean isWordStart(char ch) {
        return Character.isLetter(ch) || ch == '_';
    }

    static int lineCommentEnd(String sql, int start) {
        int i = start + 2;
        while (i < sql.length() && sql.charAt(i) != '\n')
            i++;
        return i;
    }

    static int blockCommentEnd(String sql, int start) {
        int close = sql.indexOf("*/", start + 2);
        return close < 0 ? sql.length() : close + 2;
    }

    /** Index just past the closing quote; doubled quotes are escapes. */
    static int quotedEnd(String sql, int start, char quote) {
        int i = start + 1;
        int length = sql.length();
        while (i < length) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < length && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return length;
    }

    private static String unquote(String sql, int start, int end, char quote) {
        int innerEnd = end > start + 1 && sql.charAt(end - 1) == quote ? end - 1 : end;
        String inner = sql.substring(start + 1, Math.max(start + 1, innerEnd));
        String doubled = String.valueOf(quote) + quote;
        return inner.replace(doubled, String.valueOf(quote));
    }

    private static void blank(char[] out, int from, int to) {
        for (int i = from; i < to && i < out.length; i++) {
            out[i] = ' ';
        }
    }
}
