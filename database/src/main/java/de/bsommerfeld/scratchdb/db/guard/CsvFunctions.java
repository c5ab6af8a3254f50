package de.bsommerfeld.scratchdb.db.guard;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CSV helpers behind {@code csv_parse}, {@code csv_column} and
 * {@code csv_headers}. The text is normalized (BOM, line endings, Excel
 * {@code sep=} prefix), the delimiter is picked from
 * {@code , \t ; | ^} by per-line consistency, and the rows are read with
 * Jackson's CSV parser. Results are JSON arrays usable with
 * {@code json_each()}.
 */
final class CsvFunctions {

    private static final CsvMapper MAPPER = new CsvMapper();

    private static final char[] DELIMITERS = { ',', '\t', ';', '|', '^' };
    private static final int MAX_SAMPLE_LINES = 20;
    private static final int MAX_SAMPLE_CHARS = 20_000;
    private static final int MAX_ROWS = 10_000;
    private static final int MAX_COLUMNS = 100;

    private static final Pattern SEP_PREFIX = Pattern.compile("(?i)^sep=(.)\\s*$");

    private CsvFunctions() {
    }

    /**
     * With a header: array of objects keyed by the (deduplicated) header.
     * Without: array of arrays.
     */
    static String parse(String text, boolean hasHeader) throws IOException {
        if (text == null)
            return null;
        Normalized input = normalize(text);
        if (input.text().isBlank())
            return "[]";

        List<List<String>> raw = readRows(input, MAX_ROWS + (hasHeader ? 1 : 0) + 10);
        List<String> headers = null;
        List<Map<String, String>> objects = new ArrayList<>();
        List<List<String>> arrays = new ArrayList<>();
        int rowIndex = 0;
        for (List<String> source : raw) {
            if (rowIndex >= MAX_ROWS + (hasHeader ? 1 : 0))
                break;
            List<String> row = new ArrayList<>(source.subList(0, Math.min(source.size(), MAX_COLUMNS)));
            if (isBlankRow(row))
                continue;

            if (hasHeader && headers == null) {
                headers = dedupeHeaders(row);
                rowIndex++;
                continue;
            }
            if (hasHeader) {
                if (row.size() > headers.size()) {
                    List<String> added = new ArrayList<>();
                    for (int idx = headers.size(); idx < row.size(); idx++)
                        added.add("col_" + idx);
                    headers.addAll(added);
                    for (Map<String, String> existing : objects)
                        added.forEach(h -> existing.put(h, ""));
                }
                while (row.size() < headers.size())
                    row.add("");
                Map<String, String> object = new LinkedHashMap<>();
                for (int idx = 0; idx < headers.size(); idx++)
                    object.put(headers.get(idx), row.get(idx));
                objects.add(object);
            } else {
                arrays.add(row);
            }
            rowIndex++;
        }
        return TextFunctions.toJson(hasHeader ? objects : arrays);
    }

    static String column(String text, int column, boolean hasHeader) throws IOException {
        if (text == null || column < 0)
            return null;
        Normalized input = normalize(text);
        if (input.text().isBlank())
            return "[]";

        List<String> values = new ArrayList<>();
        int rowIndex = 0;
        for (List<String> row : readRows(input, MAX_ROWS + (hasHeader ? 1 : 0) + 10)) {
            if (values.size() >= MAX_ROWS)
                break;
            if (isBlankRow(row))
                continue;
            if (hasHeader && rowIndex == 0) {
                rowIndex++;
                continue;
            }
            if (column < row.size())
                values.add(row.get(column));
            rowIndex++;
        }
        return TextFunctions.toJson(values);
    }

    static String headers(String text) throws IOException {
        if (text == null)
            return null;
        Normalized input = normalize(text);
        if (input.text().isBlank())
            return "[]";
        for (List<String> row : readRows(input, 2)) {
            if (!isBlankRow(row))
                return TextFunctions.toJson(dedupeHeaders(row));
        }
        return "[]";
    }

    /** Interprets a SQL argument as the has-header flag; absent means yes. */
    static boolean headerFlag(Object value) {
        if (value == null)
            return true;
        if (value instanceof Number n)
            return n.longValue() != 0;
        String lowered = value.toString().strip().toLowerCase();
        if (lowered.equals("0") || lowered.equals("false") || lowered.equals("no"))
            return false;
        if (lowered.equals("1") || lowered.equals("true") || lowered.equals("yes"))
            return true;
        try {
            return Long.parseLong(lowered) != 0;
        } catch (NumberFormatException e) {
            return true;
        }
    }

    // =====================================================================
    // Reading
    // =====================================================================

    record Normalized(String text, Character explicitDelimiter) {
    }

    static Normalized normalize(String text) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        while (normalized.startsWith("\uFEFF"))
            normalized = normalized.substring(1);

        int newline = normalized.indexOf('\n');
        String firstLine = newline < 0 ? normalized : normalized.substring(0, newline);
        String rest = newline < 0 ? "" : normalized.substring(newline + 1);
        if (firstLine.toLowerCase().startsWith("sep=\\t"))
            return new Normalized(rest, '\t');
        Matcher sep = SEP_PREFIX.matcher(firstLine);
        if (sep.matches())
            return new Normalized(rest, sep.group(1).charAt(0));
        return new Normalized(normalized, null);
    }

    private static List<List<String>> readRows(Normalized input, int maxRows) throws IOException {
        List<String> sample = sampleLines(input.text());
        char delimiter = input.explicitDelimiter() != null
                ? input.explicitDelimiter()
                : chooseDelimiter(sample);
        boolean trimSpaces = sample.stream().anyMatch(line -> line.contains(delimiter + " "));

        CsvSchema schema = CsvSchema.emptySchema()
                .withColumnSeparator(delimiter)
                .withQuoteChar('"');
        ObjectReader reader = MAPPER.readerForListOf(String.class)
                .with(schema)
                .with(CsvParser.Feature.WRAP_AS_ARRAY);
        if (trimSpaces)
            reader = reader.with(CsvParser.Feature.TRIM_SPACES);

        List<List<String>> rows = new ArrayList<>();
        try (MappingIterator<List<String>> it = reader.readValues(input.text())) {
            while (it.hasNextValue() && rows.size() < maxRows) {
                rows.add(it.nextValue());
            }
        }
        return rows;
    }

    private static List<String> sampleLines(String text) {
        String sample = text.length() > MAX_SAMPLE_CHARS ? text.substring(0, MAX_SAMPLE_CHARS) : text;
        List<String> lines = new ArrayList<>();
        for (String line : sample.split("\n")) {
            if (line.isBlank())
                continue;
            lines.add(line);
            if (lines.size() >= MAX_SAMPLE_LINES)
                break;
        }
        return lines;
    }

    /**
     * Scores each candidate by how consistently it appears per line times
     * how often; falls back to a comma.
     */
    static char chooseDelimiter(List<String> lines) {
        double bestScore = 0.0;
        char best = ',';
        for (char delimiter : DELIMITERS) {
            List<Integer> nonZero = new ArrayList<>();
            for (String line : lines) {
                int count = (int) line.chars().filter(c -> c == delimiter).count();
                if (count > 0)
                    nonZero.add(count);
            }
            if (nonZero.size() < 2)
                continue;
            Map<Integer, Integer> frequency = new HashMap<>();
            nonZero.forEach(c -> frequency.merge(c, 1, Integer::sum));
            int mostCommon = frequency.entrySet().stream()
                    .max(Map.Entry.<Integer, Integer>comparingByValue()
                            .thenComparing(Map.Entry.comparingByKey()))
                    .map(Map.Entry::getKey)
                    .orElse(0);
            double consistency = frequency.get(mostCommon) / (double) nonZero.size();
            double score = consistency * mostCommon;
            if (score > bestScore) {
                bestScore = score;
                best = delimiter;
            }
        }
        return best;
    }

    private static boolean isBlankRow(List<String> row) {
        return row.isEmpty() || row.stream().allMatch(cell -> cell == null || cell.isBlank());
    }

    static List<String> dedupeHeaders(List<String> raw) {
        Map<String, Integer> seen = new HashMap<>();
        List<String> headers = new ArrayList<>();
        for (int idx = 0; idx < raw.size(); idx++) {
            String value = raw.get(idx) == null ? "" : raw.get(idx).strip();
            String base = value.isEmpty() ? "col_" + idx : value;
            int count = seen.getOrDefault(base, 0);
            headers.add(count > 0 ? base + "_" + (count + 1) : base);
            seen.put(base, count + 1);
        }
        return headers;
    }
}
