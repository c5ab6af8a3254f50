package de.bsommerfeld.scratchdb.db.digest;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A link between two tables. Explicit links come from the engine's foreign
 * key metadata; implicit ones are guessed from {@code <table>_id} naming.
 *
 * @param toColumn referenced column, {@code null} when the foreign key
 *                 targets the parent's primary key without naming it
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Relationship(
        String fromTable,
        String fromColumn,
        String toTable,
        String toColumn,
        Type type,
        double confidence) {

    public static final double EXPLICIT_CONFIDENCE = 1.0;
    public static final double IMPLICIT_CONFIDENCE = 0.8;

    public enum Type {
        EXPLICIT_FK("explicit_fk"), IMPLICIT_FK("implicit_fk");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

    public static Relationship explicit(String fromTable, String fromColumn, String toTable, String toColumn) {
        return new Relationship(fromTable, fromColumn, toTable, toColumn, Type.EXPLICIT_FK, EXPLICIT_CONFIDENCE);
    }

    public static Relationship implicit(String fromTable, String fromColumn, String toTable, String toColumn) {
        return new Relationship(fromTable, fromColumn, toTable, toColumn, Type.IMPLICIT_FK, IMPLICIT_CONFIDENCE);
    }

    public String toCompact() {
        String target = toColumn == null ? toTable : toTable + "." + toColumn;
        String suffix = type == Type.IMPLICIT_FK ? " (" + DatabaseDigest.percent(confidence) + ")" : "";
        return fromTable + "." + fromColumn + " -> " + target + suffix;
    }
}
