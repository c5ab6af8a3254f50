package de.bsommerfeld.scratchdb.db.digest;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Infers type, content pattern, cardinality and simple statistics for one
 * column from a sample of its values.
 */
final class ColumnProfiler {

    static final int TYPE_SAMPLE = 200;
    static final int UNIQUE_SAMPLE = 500;
    static final int PATTERN_PREFIX = 200;
    static final double DOMINANT_TYPE_SHARE = 0.8;
    static final double PATTERN_SHARE = 0.5;

    /** Content patterns, tried in order; the first match wins. */
    enum ContentPattern {
        UUID("uuid", "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$", 0),
        EMAIL("email", "^[^@]+@[^@]+\\.[^@]+$", 0),
        URL("url", "^https?://\\S+$", 0),
        JSON_OBJECT("json_object", "^\\s*\\{.*\\}\\s*$", Pattern.DOTALL),
        JSON_ARRAY("json_array", "^\\s*\\[.*\\]\\s*$", Pattern.DOTALL),
        ISO_DATETIME("iso_datetime", "^\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}", 0),
        ISO_DATE("iso_date", "^\\d{4}-\\d{2}-\\d{2}$", 0),
        UNIX_TIMESTAMP("unix_timestamp", "^1[0-9]{9}$", 0),
        BASE64("base64", "^[A-Za-z0-9+/]{20,}={0,2}$", 0),
        HEX("hex", "^[0-9a-fA-F]{16,}$", 0),
        NUMERIC_STRING("numeric_string", "^-?\\d+\\.?\\d*$", 0),
        EMPTY("empty", "^\\s*$", 0),
        PATH("path", "^(/|[A-Za-z]:\\\\)[\\w./\\\\-]+$", 0);

        private final String label;
        private final Pattern pattern;

        ContentPattern(String label, String regex, int flags) {
            this.label = label;
            this.pattern = Pattern.compile(regex, flags);
        }

        String label() {
            return label;
        }

        /** Anchored at the start only, so prefixes like a datetime match. */
        boolean matches(String text) {
            return pattern.matcher(text).lookingAt();
        }

        static ContentPattern detect(String text) {
            for (ContentPattern candidate : values()) {
                if (candidate.matches(text))
                    return candidate;
            }
            return null;
        }
    }

    private ColumnProfiler() {
    }

    static ColumnDigest profile(String name, String declaredType, List<SqlValue> values, boolean primaryKey,
            boolean foreignKey, boolean indexed) {
        if (values.isEmpty()) {
            return new ColumnDigest(name, declaredType, "UNKNOWN", 1.0, 0.0, "unknown", "(no data)",
                    null, null, null, null, null, primaryKey, foreignKey, indexed);
        }

        List<SqlValue> nonNull = new ArrayList<>();
        for (SqlValue value : values) {
            if (!value.isNull())
                nonNull.add(value);
        }
        double nullPct = (double) (values.size() - nonNull.size()) / values.size();
        if (nonNull.isEmpty()) {
            return new ColumnDigest(name, declaredType, "NULL", 1.0, 0.0, "constant", "(all null)",
                    null, null, null, null, null, primaryKey, foreignKey, indexed);
        }

        Set<String> distinct = new HashSet<>();
        for (SqlValue value : nonNull.subList(0, Math.min(UNIQUE_SAMPLE, nonNull.size()))) {
            String text = value.display();
            distinct.add(text.length() > 100 ? text.substring(0, 100) : text);
        }
        double uniquePct = (double) distinct.size() / nonNull.size();

        String[] typeAndPattern = detectActualType(nonNull);
        String actualType = typeAndPattern[0];
        String contentPattern = typeAndPattern[1];

        Double min = null;
        Double max = null;
        if (actualType.equals("INTEGER") || actualType.equals("FLOAT")) {
            for (SqlValue value : nonNull) {
                if (!value.isNumeric())
                    continue;
                double number = value.asDouble();
                min = min == null ? number : Math.min(min, number);
                max = max == null ? number : Math.max(max, number);
            }
        }

        Double avgLength = null;
        Double entropy = null;
        if (List.of("TEXT", "JSON", "UUID", "EMAIL", "URL", "PATH").contains(actualType)) {
            List<String> texts = new ArrayList<>();
            for (SqlValue value : nonNull)
                texts.add(value.display());
            long totalLength = 0;
            int measured = Math.min(100, texts.size());
            for (String text : texts.subList(0, measured))
                totalLength += text.codePointCount(0, text.length());
            avgLength = round((double) totalLength / measured, 1);

            String combined = String.join("", texts.subList(0, Math.min(50, texts.size())));
            if (combined.length() > 5000)
                combined = combined.substring(0, 5000);
            entropy = round(entropy(combined), 2);
        }

        return new ColumnDigest(name, declaredType, actualType, round(nullPct, 3), round(uniquePct, 3),
                cardinality(uniquePct), sampleValues(nonNull), min, max, avgLength, contentPattern, entropy,
                primaryKey, foreignKey, indexed);
    }

    /**
     * Dominant storage class of the first values, or {@code MIXED} below an
     * 80% share. A content pattern matching more than half of the textual
     * values refines it.
     *
     * @return {@code [actualType, contentPattern-or-null]}
     */
    static String[] detectActualType(List<SqlValue> nonNull) {
        Map<String, Integer> typeCounts = new LinkedHashMap<>();
        Map<ContentPattern, Integer> patternCounts = new LinkedHashMap<>();

        for (SqlValue value : nonNull.subList(0, Math.min(TYPE_SAMPLE, nonNull.size()))) {
            typeCounts.merge(value.kind().name(), 1, Integer::sum);
            if (value.kind() == SqlValue.Kind.TEXT) {
                String text = (String) value.value();
                ContentPattern match = ContentPattern.detect(
                        text.length() > PATTERN_PREFIX ? text.substring(0, PATTERN_PREFIX) : text);
                if (match != null)
                    patternCounts.merge(match, 1, Integer::sum);
            }
        }
        if (typeCounts.isEmpty())
            return new String[] { "UNKNOWN", null };

        Map.Entry<String, Integer> dominant = mostCommon(typeCounts);
        int total = typeCounts.values().stream().mapToInt(Integer::intValue).sum();
        String actualType = (double) dominant.getValue() / total < DOMINANT_TYPE_SHARE ? "MIXED" : dominant.getKey();

        String contentPattern = null;
        int textCount = typeCounts.getOrDefault("TEXT", 0);
        if (!patternCounts.isEmpty() && textCount > 0) {
            Map.Entry<ContentPattern, Integer> top = mostCommon(patternCounts);
            if ((double) top.getValue() / textCount > PATTERN_SHARE) {
                contentPattern = top.getKey().label();
                switch (top.getKey()) {
                    case JSON_OBJECT, JSON_ARRAY -> {
                        actualType = "JSON";
                        contentPattern = "json";
                    }
                    case UUID -> actualType = "UUID";
                    case EMAIL -> actualType = "EMAIL";
                    case URL -> actualType = "URL";
                    case PATH -> actualType = "PATH";
                    case ISO_DATETIME -> {
                        actualType = "DATETIME";
                        contentPattern = "datetime";
                    }
                    case ISO_DATE -> {
                        actualType = "DATETIME";
                        contentPattern = "date";
                    }
                    case UNIX_TIMESTAMP -> {
                        actualType = "DATETIME";
                        contentPattern = "timestamp";
                    }
                    case BASE64, HEX -> contentPattern = "hash";
                    default -> {
                    }
                }
            }
        }
        return new String[] { actualType, contentPattern };
    }

    /** First key with the highest count. */
    private static <K> Map.Entry<K, Integer> mostCommon(Map<K, Integer> counts) {
        Map.Entry<K, Integer> best = null;
        for (Map.Entry<K, Integer> entry : counts.entrySet()) {
            if (best == null || entry.getValue() > best.getValue())
                best = entry;
        }
        return best;
    }

    static String cardinality(double uniquePct) {
        if (uniquePct >= 0.95)
            return "unique";
        if (uniquePct >= 0.50)
            return "high";
        if (uniquePct >= 0.10)
            return "medium";
        if (uniquePct >= 0.01)
            return "low";
        return "constant";
    }

    /** Shannon entropy in bits per character. */
    static double entropy(String text) {
        if (text.isEmpty())
            return 0.0;
        Map<Integer, Integer> frequencies = new HashMap<>();
        text.codePoints().forEach(cp -> frequencies.merge(cp, 1, Integer::sum));
        double n = text.codePointCount(0, text.length());
        double entropy = 0.0;
        for (int count : frequencies.values()) {
            double p = count / n;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    static String sampleValues(List<SqlValue> nonNull) {
        List<String> samples = new ArrayList<>();
        for (SqlValue value : nonNull.subList(0, Math.min(5, nonNull.size()))) {
            String text = value.display();
            samples.add(text.length() > 30 ? text.substring(0, 27) + "..." : text);
        }
        if (samples.isEmpty())
            return "(empty)";
        String joined = String.join(", ", samples);
        return joined.length() > 80 ? joined.substring(0, 77) + "..." : joined;
    }

    static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
