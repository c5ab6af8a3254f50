package de.bsommerfeld.scratchdb.agent.sync;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Validation of agent schedules: a five-field cron expression
 * ({@code minute hour day-of-month month day-of-week}) or one of the
 * {@code @} aliases. Schedules may fire at most twice per hour, at least 30
 * minutes apart.
 */
public final class ScheduleExpressions {

    static final Set<String> ALIASES = Set.of("@yearly", "@annually", "@monthly", "@weekly", "@daily",
            "@midnight", "@hourly");

    private static final List<String> MONTHS = List.of("JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG",
            "SEP", "OCT", "NOV", "DEC");
    private static final List<String> DAYS = List.of("SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT");

    private static final int MIN_GAP_MINUTES = 30;

    private ScheduleExpressions() {
    }

    /**
     * @return why {@code expression} is not an acceptable schedule, or empty
     *         if it is
     */
    public static Optional<String> validate(String expression) {
        if (expression == null || expression.isBlank())
            return Optional.of("schedule is empty");

        String trimmed = expression.trim();
        if (trimmed.startsWith("@")) {
            return ALIASES.contains(trimmed.toLowerCase(Locale.ROOT))
                    ? Optional.empty()
                    : Optional.of("unknown schedule alias '" + trimmed + "'");
        }

        String[] fields = trimmed.split("\\s+");
        if (fields.length != 5)
            return Optional.of("expected 5 cron fields (minute hour day month weekday), got " + fields.length);

        try {
            Set<Integer> minutes = expand(fields[0], 0, 59, List.of(), "minute");
            expand(fields[1], 0, 23, List.of(), "hour");
            expand(fields[2], 1, 31, List.of(), "day-of-month");
            expand(fields[3], 1, 12, MONTHS, "month");
            expand(fields[4], 0, 7, DAYS, "day-of-week");
            return checkFrequency(minutes);
        } catch (IllegalArgumentException e) {
            return Optional.of(e.getMessage());
        }
    }

    private static Optional<String> checkFrequency(Set<Integer> minutes) {
        if (minutes.size() > 2)
            return Optional.of("Schedule is too frequent (runs more than twice per hour).");
        if (minutes.size() == 2) {
            Integer[] sorted = minutes.toArray(new Integer[0]);
            int gap = sorted[1] - sorted[0];
            if (gap < MIN_GAP_MINUTES || 60 - gap < MIN_GAP_MINUTES)
                return Optional.of("Schedule is too frequent (interval is less than 30 minutes).");
        }
        return Optional.empty();
    }

    /**
     * Expands one cron field into the values it matches. Supports lists,
     * ranges, steps and (for month and weekday) three-letter names.
     *
     * @throws IllegalArgumentException with a readable message on any syntax
     *                                  or range error
     */
    static Set<Integer> expand(String field, int min, int max, List<String> names, String label) {
        Set<Integer> values = new TreeSet<>();
        for (String part : field.split(",", -1)) {
            if (part.isEmpty())
                throw new IllegalArgumentException("empty entry in " + label + " field '" + field + "'");

            int step = 1;
            String range = part;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                step = parseNumber(part.substring(slash + 1), label);
                if (step <= 0)
                    throw new IllegalArgumentException("step must be positive in " + label + " field '" + field + "'");
            }

            int from;
            int to;
            if (range.equals("*")) {
                from = min;
                to = max;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-", 2);
                from = parseValue(bounds[0], names, min, label);
                to = parseValue(bounds[1], names, min, label);
            } else {
                from = parseValue(range, names, min, label);
                to = slash >= 0 ? max : from;
            }

            if (from < min || to > max || from > to)
                throw new IllegalArgumentException(label + " value out of range in '" + field + "' (allowed "
                        + min + "-" + max + ")");
            for (int v = from; v <= to; v += step)
                values.add(v);
        }
        return values;
    }

    private static int parseValue(String token, List<String> names, int min, String label) {
        int index = names.indexOf(token.toUpperCase(Locale.ROOT));
        if (index >= 0)
            return index + min;
        return parseNumber(token, label);
    }

    private static int parseNumber(String token, String label) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + label + " value '" + token + "'", e);
        }
    }
}
