package de.bsommerfeld.scratchdb.db.digest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Per-table profile. {@code sizeBytes} is a rough estimate (rows times
 * columns times 50), not a page count.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TableDigest(
        String name,
        long rowCount,
        int columnCount,
        long sizeBytes,
        List<ColumnDigest> columns,
        String primaryKey,
        List<String> foreignKeys,
        List<String> indexes,
        double nullDensity,
        boolean junction,
        boolean lookup,
        boolean log) {

    public TableDigest {
        columns = List.copyOf(columns);
        foreignKeys = List.copyOf(foreignKeys);
        indexes = List.copyOf(indexes);
    }

    /** {@code orders: 1,204 rows x 6 cols (log) | id, ts, action, +3 more} */
    public String toCompact() {
        List<String> roles = new ArrayList<>();
        if (junction)
            roles.add("junction");
        if (lookup)
            roles.add("lookup");
        if (log)
            roles.add("log");
        String roleText = roles.isEmpty() ? "" : " (" + String.join(", ", roles) + ")";

        String columnText = columns.stream().limit(5).map(ColumnDigest::name).collect(Collectors.joining(", "));
        if (columns.size() > 5)
            columnText += ", +" + (columns.size() - 5) + " more";
        return name + ": " + String.format(Locale.ROOT, "%,d", rowCount) + " rows x " + columnCount + " cols"
                + roleText + " | " + columnText;
    }
}
