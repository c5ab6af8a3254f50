package de.bsommerfeld.scratchdb.db.digest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;

/**
 * Sampled statistics for one column. {@code actualType} is what the values
 * look like, which may differ from the declared affinity.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ColumnDigest(
        String name,
        String declaredType,
        String actualType,
        double nullPct,
        double uniquePct,
        String cardinalityClass,
        String sampleValues,
        Double minValue,
        Double maxValue,
        Double avgLength,
        String contentPattern,
        Double entropy,
        boolean primaryKey,
        boolean foreignKey,
        boolean indexed) {

    /** {@code name: TYPE(pattern) | null:0% uniq:100% [PK,FK]} */
    public String toCompact() {
        List<String> flags = new ArrayList<>();
        if (primaryKey)
            flags.add("PK");
        if (foreignKey)
            flags.add("FK");
        if (indexed && !primaryKey)
            flags.add("IDX");
        String flagText = flags.isEmpty() ? "" : " [" + String.join(",", flags) + "]";
        String typeText = contentPattern != null && !contentPattern.equals(actualType)
                ? actualType + "(" + contentPattern + ")"
                : actualType;
        return name + ": " + typeText + " | null:" + DatabaseDigest.percent(nullPct)
                + " uniq:" + DatabaseDigest.percent(uniquePct) + flagText;
    }
}
