package de.bsommerfeld.scratchdb.db.guard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.Function;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Registers the application-defined SQL functions available inside a
 * {@link GuardedSession}: pattern matching, text extraction, CSV parsing,
 * data cleaning, dialect aliases and the statistical aggregates of
 * {@link StatAggregates}.
 *
 * <p>
 * Every function returns {@code NULL} instead of failing when its body
 * throws; only a wrong argument count is reported as an SQL error.
 */
final class SafeFunctions {

    private static final Logger LOG = LoggerFactory.getLogger(SafeFunctions.class);

    private static final int SQLITE_INTEGER = 1;
    private static final int SQLITE_FLOAT = 2;
    private static final int SQLITE_BLOB = 4;
    private static final int SQLITE_NULL = 5;

    private SafeFunctions() {
    }

    static void install(Connection connection) throws SQLException {
        // -- Pattern search --
        register(connection, "REGEXP", 2, 2,
                a -> TextFunctions.regexp(a.text(0), a.text(1)));
        register(connection, "regexp_extract", 2, 3,
                a -> TextFunctions.regexpExtract(a.text(0), a.text(1), a.integer(2, 0)));
        register(connection, "regexp_find_all", 2, 3,
                a -> TextFunctions.regexpFindAll(a.text(0), a.text(1), a.textOr(2, "|")));
        register(connection, "grep_context", 2, 3,
                a -> TextFunctions.grepContext(a.text(0), a.text(1), a.integer(2, 100)));
        register(connection, "grep_context_all", 2, 4,
                a -> TextFunctions.grepContextAll(a.text(0), a.text(1), a.integer(2, 50), a.integer(3, 10)));

        // -- Slicing and counting --
        register(connection, "split_sections", 1, 2,
                a -> TextFunctions.splitSections(a.text(0), a.text(1)));
        register(connection, "substr_range", 3, 3,
                a -> TextFunctions.substrRange(a.text(0), a.integer(1, 0), a.integer(2, 0)));
        register(connection, "word_count", 1, 1, a -> TextFunctions.wordCount(a.text(0)));
        register(connection, "char_count", 1, 1, a -> TextFunctions.charCount(a.text(0)));
        register(connection, "json_length", 1, 1, a -> TextFunctions.jsonLength(a.text(0)));

        // -- CSV --
        register(connection, "csv_parse", 1, 2,
                a -> CsvFunctions.parse(a.text(0), CsvFunctions.headerFlag(a.raw(1))));
        register(connection, "csv_column", 2, 3,
                a -> CsvFunctions.column(a.text(0), a.integer(1, -1), CsvFunctions.headerFlag(a.raw(2))));
        register(connection, "csv_headers", 1, 1, a -> CsvFunctions.headers(a.text(0)));

        // -- Cleaning and extraction --
        register(connection, "html_to_text", 1, 1, a -> TextFunctions.htmlToText(a.text(0)));
        register(connection, "clean_text", 1, 1, a -> TextFunctions.cleanText(a.text(0)));
        register(connection, "parse_number", 1, 1, a -> TextFunctions.parseNumber(a.text(0)));
        register(connection, "parse_date", 1, 2,
                a -> TextFunctions.parseDate(a.text(0), a.textOr(1, "%Y-%m-%d")));
        register(connection, "url_extract", 1, 2,
                a -> TextFunctions.urlExtract(a.text(0), a.textOr(1, "domain")));
        register(connection, "extract_json", 1, 1, a -> TextFunctions.extractJson(a.text(0)));
        register(connection, "extract_emails", 1, 1, a -> TextFunctions.extractEmails(a.text(0)));
        register(connection, "extract_urls", 1, 1, a -> TextFunctions.extractUrls(a.text(0)));

        // -- Dialect aliases --
        register(connection, "NOW", 0, 0, a -> TextFunctions.now());
        register(connection, "GETDATE", 0, 0, a -> TextFunctions.now());
        register(connection, "CURDATE", 0, 0, a -> TextFunctions.curdate());
        register(connection, "LEN", 1, 1, a -> a.raw(0) == null ? null : a.text(0).length());
        register(connection, "NVL", 2, 2, a -> a.raw(0) != null ? a.raw(0) : a.raw(1));
        register(connection, "LEFT", 2, 2, a -> TextFunctions.left(a.text(0), a.integer(1, 0)));
        register(connection, "RIGHT", 2, 2, a -> TextFunctions.right(a.text(0), a.integer(1, 0)));
        register(connection, "REVERSE", 1, 1, a -> TextFunctions.reverse(a.text(0)));
        register(connection, "LPAD", 2, 3,
                a -> TextFunctions.lpad(a.text(0), a.integer(1, 0), a.textOr(2, " ")));
        register(connection, "RPAD", 2, 3,
                a -> TextFunctions.rpad(a.text(0), a.integer(1, 0), a.textOr(2, " ")));
        register(connection, "SPLIT_PART", 3, 3,
                a -> TextFunctions.splitPart(a.text(0), a.text(1), a.integer(2, 0)));

        StatAggregates.install(connection);
        LOG.debug("Registered sandbox SQL functions");
    }

    private static void register(Connection connection, String name, int minArgs, int maxArgs, Body body)
            throws SQLException {
        Function.create(connection, name, new Scalar(name, minArgs, maxArgs, body));
    }

    /** The computation behind one scalar function. */
    @FunctionalInterface
    interface Body {
        Object apply(Scalar.Args args) throws IOException;
    }

    /**
     * Adapts a {@link Body} to the driver's callback API. Registered as
     * variadic; the arity is checked on every call.
     */
    static final class Scalar extends Function {

        private final String name;
        private final int minArgs;
        private final int maxArgs;
        private final Body body;

        Scalar(String name, int minArgs, int maxArgs, Body body) {
            this.name = name;
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
            this.body = body;
        }

        @Override
        protected void xFunc() throws SQLException {
            int count = args();
            if (count < minArgs || count > maxArgs) {
                error("wrong number of arguments to function " + name + "()");
                return;
            }
            Object value;
            try {
                value = body.apply(new Args(count));
            } catch (IOException | RuntimeException e) {
                LOG.debug("SQL function {}() failed, returning NULL", name, e);
                value = null;
            }
            emit(value);
        }

        private void emit(Object value) throws SQLException {
            if (value == null) {
                result();
            } else if (value instanceof String s) {
                result(s);
            } else if (value instanceof Boolean b) {
                result(b ? 1 : 0);
            } else if (value instanceof Integer i) {
                result(i);
            } else if (value instanceof Long l) {
                result(l);
            } else if (value instanceof Double d) {
                result(d);
            } else if (value instanceof byte[] bytes) {
                result(bytes);
            } else {
                result(value.toString());
            }
        }

        /** Read access to the current call's arguments. */
        final class Args {

            private final int count;

            private Args(int count) {
                this.count = count;
            }

            int count() {
                return count;
            }

            /** Text value of argument {@code i}, {@code null} when absent or NULL. */
            String text(int i) throws IOException {
                try {
                    if (i >= count || Scalar.this.value_type(i) == SQLITE_NULL)
                        return null;
                    return Scalar.this.value_text(i);
                } catch (SQLException e) {
                    throw new IOException("Failed to read argument " + i, e);
                }
            }

            String textOr(int i, String fallback) throws IOException {
                String value = text(i);
                return value == null ? fallback : value;
            }

            int integer(int i, int fallback) throws IOException {
                Object value = raw(i);
                if (value == null)
                    return fallback;
                if (value instanceof Number n)
                    return n.intValue();
                try {
                    return (int) Double.parseDouble(value.toString().strip());
                } catch (NumberFormatException e) {
                    return fallback;
                }
            }

            /** Argument {@code i} with its storage class preserved. */
            Object raw(int i) throws IOException {
                if (i >= count)
                    return null;
                try {
                    switch (Scalar.this.value_type(i)) {
                        case SQLITE_NULL:
                            return null;
                        case SQLITE_INTEGER:
                            return Scalar.this.value_long(i);
                        case SQLITE_FLOAT:
                            return Scalar.this.value_double(i);
                        case SQLITE_BLOB:
                            return Scalar.this.value_blob(i);
                        default:
                            return Scalar.this.value_text(i);
                    }
                } catch (SQLException e) {
                    throw new IOException("Failed to read argument " + i, e);
                }
            }
        }
    }
}
