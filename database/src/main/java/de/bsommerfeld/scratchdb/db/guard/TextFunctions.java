package de.bsommerfeld.scratchdb.db.guard;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Splitter;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.jsoup.parser.Parser;

import java.net.URI;
import java.text.Normalizer;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Pure text helpers behind the SQL functions registered by
 * {@link SafeFunctions}. Strings in, strings/booleans/numbers out; a
 * {@code null} input or an invalid pattern yields {@code null} (or
 * {@code false}/0 where the SQL function returns a flag or a count).
 */
final class TextFunctions {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final LoadingCache<String, Pattern> PATTERNS = CacheBuilder.newBuilder()
            .maximumSize(256)
            .build(CacheLoader.from(Pattern::compile));

    private static final LoadingCache<String, Pattern> PATTERNS_CI = CacheBuilder.newBuilder()
            .maximumSize(64)
            .build(CacheLoader.from(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE)));

    private static final int MAX_FIND_ALL = 20;

    private TextFunctions() {
    }

    // =====================================================================
    // Pattern search
    // =====================================================================

    static boolean regexp(String pattern, String text) {
        if (pattern == null || text == null)
            return false;
        Pattern compiled = compile(pattern, false);
        return compiled != null && compiled.matcher(text).find();
    }

    static String regexpExtract(String text, String pattern, int group) {
        if (text == null || pattern == null)
            return null;
        Pattern compiled = compile(pattern, false);
        if (compiled == null)
            return null;
        Matcher m = compiled.matcher(text);
        if (!m.find() || group < 0 || group > m.groupCount())
            return null;
        return m.group(group);
    }

    /** Distinct matches in order of appearance, at most 20. */
    static String regexpFindAll(String text, String pattern, String separator) {
        if (text == null || pattern == null)
            return null;
        Pattern compiled = compile(pattern, false);
        if (compiled == null)
            return null;
        Set<String> unique = new LinkedHashSet<>();
        Matcher m = compiled.matcher(text);
        while (m.find() && unique.size() < MAX_FIND_ALL) {
            String match = m.groupCount() == 1 ? m.group(1) : m.group();
            unique.add(match == null ? "" : match);
        }
        return unique.isEmpty() ? null : String.join(separator == null ? "|" : separator, unique);
    }

    /** First case-insensitive match with surrounding context. */
    static String grepContext(String text, String pattern, int contextChars) {
        if (text == null || pattern == null)
            return null;
        Pattern compiled = compile(pattern, true);
        if (compiled == null)
            return null;
        Matcher m = compiled.matcher(text);
        if (!m.find())
            return null;
        return snippet(text, m.start(), m.end(), contextChars, false);
    }

    static String grepContextAll(String text, String pattern, int contextChars, int maxMatches) {
        if (text == null || pattern == null)
            return null;
        Pattern compiled = compile(pattern, false);
        if (compiled == null)
            return null;
        List<String> results = new ArrayList<>();
        Matcher m = compiled.matcher(text);
        while (results.size() < maxMatches && m.find()) {
            results.add(snippet(text, m.start(), m.end(), contextChars, true));
        }
        return results.isEmpty() ? null : toJson(results);
    }

    private static String snippet(String text, int matchStart, int matchEnd, int contextChars, boolean flatten) {
        int start = Math.max(0, matchStart - Math.max(0, contextChars));
        int end = Math.min(text.length(), matchEnd + Math.max(0, contextChars));
        String body = text.substring(start, end);
        if (flatten)
            body = body.replace('\n', ' ');
        return (start > 0 ? "..." : "") + body + (end < text.length() ? "..." : "");
    }

    private static Pattern compile(String pattern, boolean caseInsensitive) {
        try {
            return caseInsensitive ? PATTERNS_CI.getUnchecked(pattern) : PATTERNS.getUnchecked(pattern);
        } catch (UncheckedExecutionException e) {
            if (e.getCause() instanceof PatternSyntaxException)
                return null;
            throw e;
        }
    }

    // =====================================================================
    // Slicing and counting
    // =====================================================================

    static String splitSections(String text, String delimiter) {
        if (text == null)
            return null;
        String separator = delimiter == null || delimiter.isEmpty() ? "\n\n" : delimiter;
        List<String> sections = new ArrayList<>();
        for (String part : Splitter.on(separator).split(text)) {
            String trimmed = part.strip();
            if (!trimmed.isEmpty())
                sections.add(trimmed);
        }
        return sections.isEmpty() ? null : toJson(sections);
    }

    /** Zero-based, end exclusive; negative bounds count from the end. */
    static String substrRange(String text, int start, int end) {
        if (text == null)
            return null;
        return slice(text, start, end);
    }

    static int wordCount(String text) {
        if (text == null || text.isBlank())
            return 0;
        return text.strip().split("\\s+").length;
    }

    static int charCount(String text) {
        return text == null ? 0 : text.length();
    }

    static Integer jsonLength(String json) {
        if (json == null)
            return null;
        try {
            JsonNode node = JSON.readTree(json);
            if (node != null && (node.isArray() || node.isObject()))
                return node.size();
            return null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    // =====================================================================
    // Cleaning
    // =====================================================================

    private static final Pattern SCRIPT = Pattern.compile("<script[^>]*>.*?</script>",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern STYLE = Pattern.compile("<style[^>]*>.*?</style>",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern BLOCK_TAG = Pattern.compile("<(?:p|div|br|hr|li|tr|h[1-6])[^>]*>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_TAG = Pattern.compile("<[^>]+>");

    static String htmlToText(String html) {
        if (html == null)
            return null;
        String text = SCRIPT.matcher(html).replaceAll(" ");
        text = STYLE.matcher(text).replaceAll(" ");
        text = BLOCK_TAG.matcher(text).replaceAll("\n");
        text = ANY_TAG.matcher(text).replaceAll(" ");
        text = Parser.unescapeEntities(text, false);
        text = text.replaceAll("[ \\t]+", " ");
        text = text.replaceAll("\\n[ \\t]+", "\n");
        text = text.replaceAll("[ \\t]+\\n", "\n");
        text = text.replaceAll("\\n{3,}", "\n\n");
        return text.strip();
    }

    static String cleanText(String text) {
        if (text == null)
            return null;
        String out = Normalizer.normalize(text, Normalizer.Form.NFC);
        out = out.replaceAll("[\\u200b\\u200c\\u200d\\ufeff]", "");
        out = out.replace('“', '"').replace('”', '"')
                .replace('‘', '\'').replace('’', '\'');
        out = out.replace('–', '-').replace('—', '-');
        out = out.replace("…", "...");
        out = out.replaceAll("[ \\t]+", " ");
        out = out.replaceAll(" ?\\n ?", "\n");
        out = out.replaceAll("\\n{3,}", "\n\n");
        return out.strip();
    }

    private static final Pattern CURRENCY_PREFIX = Pattern.compile("^[£$€¥₹₽\\s]+");
    private static final Pattern CURRENCY_SUFFIX = Pattern.compile("[£$€¥₹₽\\s]+$");
    private static final Pattern MULTIPLIER = Pattern.compile("([KkMmBbTt])\\s*$");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Map<Character, Double> MULTIPLIERS = Map.of('K', 1e3, 'M', 1e6, 'B', 1e9, 'T', 1e12);

    /**
     * Parses {@code $1,234.56}, {@code €1.234,56}, {@code 1.2M},
     * {@code (100)} and similar. European decimal commas are recognized when
     * the comma follows the last dot with at most two digits after it, or
     * when there is no dot and exactly two digits follow.
     */
    static Double parseNumber(String raw) {
        if (raw == null)
            return null;
        String text = raw.strip();
        if (text.isEmpty())
            return null;

        boolean negative = false;
        if (text.startsWith("(") && text.endsWith(")") && text.length() >= 2) {
            negative = true;
            text = text.substring(1, text.length() - 1);
        }
        if (text.startsWith("-")) {
            negative = true;
            text = text.substring(1);
        }
        text = CURRENCY_PREFIX.matcher(text).replaceFirst("");
        text = CURRENCY_SUFFIX.matcher(text).replaceFirst("");

        double multiplier = 1.0;
        Matcher suffix = MULTIPLIER.matcher(text);
        if (suffix.find()) {
            multiplier = MULTIPLIERS.getOrDefault(Character.toUpperCase(suffix.group(1).charAt(0)), 1.0);
            text = text.substring(0, suffix.start());
        }
        text = text.replace(" ", "");

        int commaPos = text.lastIndexOf(',');
        int dotPos = text.lastIndexOf('.');
        int charsAfterComma = commaPos >= 0 ? text.length() - commaPos - 1 : 0;
        boolean european = commaPos >= 0 && charsAfterComma <= 2
                && ((dotPos >= 0 && commaPos > dotPos) || (dotPos < 0 && charsAfterComma == 2));
        text = european ? text.replace(".", "").replace(',', '.') : text.replace(",", "");

        if (!PLAIN_NUMBER.matcher(text).matches())
            return null;
        double value = Double.parseDouble(text) * multiplier;
        return negative ? -value : value;
    }

    private static final Pattern ORDINAL = Pattern.compile("(\\d+)(st|nd|rd|th)\\b", Pattern.CASE_INSENSITIVE);

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            formatter("uuuu-M-d H:m:s"),
            formatter("uuuu-M-d'T'H:m:s"),
            formatter("uuuu-M-d'T'H:m:s'Z'"),
            formatter("uuuu-M-d"),
            formatter("uuuu/M/d"),
            formatter("d/M/uuuu H:m:s"),
            formatter("d/M/uuuu"),
            formatter("M/d/uuuu H:m:s"),
            formatter("M/d/uuuu"),
            new DateTimeFormatterBuilder().parseCaseInsensitive().appendPattern("M/d/")
                    .appendValueReduced(ChronoField.YEAR, 2, 2, 1969)
                    .toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT),
            formatter("d-M-uuuu"),
            formatter("MMMM d, uuuu"),
            formatter("MMM d, uuuu"),
            formatter("d MMMM uuuu"),
            formatter("d MMM uuuu"),
            formatter("MMMM d uuuu"),
            formatter("MMM d uuuu"),
            formatter("d MMMM, uuuu"),
            formatter("d MMM, uuuu"),
            formatter("uuuuMMdd"));

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder().parseCaseInsensitive().appendPattern(pattern)
                .toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Tries the known date layouts in order and renders the first hit with a
     * strftime-style output format (default {@code %Y-%m-%d}).
     */
    static String parseDate(String raw, String outputFormat) {
        if (raw == null)
            return null;
        String text = ORDINAL.matcher(raw.strip()).replaceAll("$1");
        if (text.isEmpty())
            return null;
        DateTimeFormatter output = DateTimeFormatter.ofPattern(
                strftimeToPattern(outputFormat == null ? "%Y-%m-%d" : outputFormat), Locale.ENGLISH);
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDateTime value = tryParse(format, text);
            if (value != null)
                return output.format(value);
        }
        return null;
    }

    private static LocalDateTime tryParse(DateTimeFormatter format, String text) {
        try {
            TemporalAccessor parsed = format.parse(text);
            return parsed.isSupported(ChronoField.HOUR_OF_DAY)
                    ? LocalDateTime.from(parsed)
                    : LocalDate.from(parsed).atStartOfDay();
        } catch (DateTimeException e) {
            return null;
        }
    }

    static String strftimeToPattern(String format) {
        StringBuilder out = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < format.length(); i++) {
            char ch = format.charAt(i);
            if (ch == '%' && i + 1 < format.length()) {
                String field = switch (format.charAt(++i)) {
                    case 'Y' -> "uuuu";
                    case 'y' -> "uu";
                    case 'm' -> "MM";
                    case 'd' -> "dd";
                    case 'H' -> "HH";
                    case 'I' -> "hh";
                    case 'M' -> "mm";
                    case 'S' -> "ss";
                    case 'p' -> "a";
                    case 'B' -> "MMMM";
                    case 'b' -> "MMM";
                    case 'A' -> "EEEE";
                    case 'a' -> "EEE";
                    case 'j' -> "DDD";
                    default -> null;
                };
                if (field != null) {
                    flushLiteral(out, literal);
                    out.append(field);
                } else {
                    literal.append(format.charAt(i) == '%' ? "%" : "%" + format.charAt(i));
                }
            } else {
                literal.append(ch);
            }
        }
        flushLiteral(out, literal);
        return out.toString();
    }

    private static void flushLiteral(StringBuilder out, StringBuilder literal) {
        if (literal.length() == 0)
            return;
        out.append('\'').append(literal.toString().replace("'", "''")).append('\'');
        literal.setLength(0);
    }

    private static final Set<String> TWO_PART_TLDS = Set.of("co.uk", "com.au", "co.nz", "co.jp", "com.br", "co.in");

    /** Parts: domain (default), host, path, query, scheme, port. */
    static String urlExtract(String url, String part) {
        if (url == null)
            return null;
        URI uri;
        try {
            uri = URI.create(url.strip());
        } catch (IllegalArgumentException e) {
            return null;
        }
        String netloc = uri.getRawAuthority() == null ? "" : uri.getRawAuthority();
        String host = netloc.split(":", -1)[0];
        switch ((part == null ? "domain" : part).toLowerCase(Locale.ROOT)) {
            case "scheme":
                return emptyToNull(uri.getScheme());
            case "host":
                return emptyToNull(host);
            case "domain": {
                if (host.isEmpty())
                    return null;
                String[] labels = host.split("\\.");
                if (labels.length >= 2) {
                    int n = labels.length;
                    if (n >= 3 && TWO_PART_TLDS.contains(labels[n - 2] + "." + labels[n - 1]))
                        return labels[n - 3] + "." + labels[n - 2] + "." + labels[n - 1];
                    return labels[n - 2] + "." + labels[n - 1];
                }
                return host;
            }
            case "path":
                return emptyToNull(uri.getRawPath());
            case "query":
                return emptyToNull(uri.getRawQuery());
            case "port": {
                int colon = netloc.indexOf(':');
                return colon >= 0 ? netloc.split(":", -1)[1] : null;
            }
            default:
                return null;
        }
    }

    // =====================================================================
    // Extraction
    // =====================================================================

    /** First balanced JSON object (tried first) or array that parses. */
    static String extractJson(String text) {
        if (text == null)
            return null;
        char[][] pairs = { { '{', '}' }, { '[', ']' } };
        for (char[] pair : pairs) {
            int start = text.indexOf(pair[0]);
            if (start < 0)
                continue;
            int depth = 0;
            boolean inString = false;
            boolean escape = false;
            for (int i = start; i < text.length(); i++) {
                char ch = text.charAt(i);
                if (escape) {
                    escape = false;
                    continue;
                }
                if (ch == '\\' && inString) {
                    escape = true;
                    continue;
                }
                if (ch == '"') {
                    inString = !inString;
                    continue;
                }
                if (inString)
                    continue;
                if (ch == pair[0]) {
                    depth++;
                } else if (ch == pair[1]) {
                    depth--;
                    if (depth == 0) {
                        String candidate = text.substring(start, i + 1);
                        if (isValidJson(candidate))
                            return candidate;
                        break;
                    }
                }
            }
        }
        return null;
    }

    private static final Pattern EMAIL = Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");
    private static final Pattern URL = Pattern.compile("https?://[^\\s<>\"')\\]}>]+");
    private static final Pattern TRAILING_PUNCT = Pattern.compile("[.,;:!?]+$");

    static String extractEmails(String text) {
        if (text == null)
            return null;
        List<String> unique = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        Matcher m = EMAIL.matcher(text);
        while (m.find()) {
            if (seen.add(m.group().toLowerCase(Locale.ROOT)))
                unique.add(m.group());
        }
        return unique.isEmpty() ? null : toJson(unique);
    }

    static String extractUrls(String text) {
        if (text == null)
            return null;
        Set<String> unique = new LinkedHashSet<>();
        Matcher m = URL.matcher(text);
        while (m.find()) {
            unique.add(TRAILING_PUNCT.matcher(m.group()).replaceFirst(""));
        }
        return unique.isEmpty() ? null : toJson(new ArrayList<>(unique));
    }

    // =====================================================================
    // Dialect aliases
    // =====================================================================

    private static final DateTimeFormatter NOW = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");
    private static final DateTimeFormatter TODAY = DateTimeFormatter.ofPattern("uuuu-MM-dd");

    static String now() {
        return NOW.format(LocalDateTime.now(ZoneOffset.UTC));
    }

    static String curdate() {
        return TODAY.format(LocalDate.now(ZoneOffset.UTC));
    }

    static String left(String s, int n) {
        return s == null ? null : slice(s, 0, n);
    }

    static String right(String s, int n) {
        if (s == null)
            return null;
        return n > 0 ? slice(s, -n, s.length()) : "";
    }

    static String reverse(String s) {
        return s == null ? null : new StringBuilder(s).reverse().toString();
    }

    static String lpad(String s, int length, String pad) {
        if (s == null)
            return null;
        if (pad == null || pad.isEmpty() || s.length() >= length)
            return s;
        String padded = pad.repeat((length - s.length()) / pad.length() + 1) + s;
        return padded.substring(padded.length() - length);
    }

    static String rpad(String s, int length, String pad) {
        if (s == null)
            return null;
        if (pad == null || pad.isEmpty() || s.length() >= length)
            return s;
        String padded = s + pad.repeat((length - s.length()) / pad.length() + 1);
        return padded.substring(0, length);
    }

    /** One-based part of {@code s} split on {@code delimiter}; "" when out of range. */
    static String splitPart(String s, String delimiter, int part) {
        if (s == null || delimiter == null || delimiter.isEmpty())
            return null;
        List<String> parts = Splitter.on(delimiter).splitToList(s);
        if (part < 1 || part > parts.size())
            return "";
        return parts.get(part - 1);
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    /** Slice with negative indexes counting from the end, bounds clamped. */
    static String slice(String s, int start, int end) {
        int length = s.length();
        int from = start < 0 ? Math.max(0, length + start) : Math.min(start, length);
        int to = end < 0 ? Math.max(0, length + end) : Math.min(end, length);
        return from >= to ? "" : s.substring(from, to);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static boolean isValidJson(String candidate) {
        try {
            JSON.readTree(candidate);
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize function result", e);
        }
    }
}
