package de.bsommerfeld.scratchdb.db.digest;

import java.util.HexFormat;

/**
 * One sampled cell, tagged with the storage class the engine reported for
 * it. The digest works on these tags instead of on Java runtime types.
 */
public record SqlValue(Kind kind, Object value) {

    public enum Kind {
        NULL, INTEGER, FLOAT, TEXT, BLOB
    }

    private static final SqlValue NULL = new SqlValue(Kind.NULL, null);

    /**
     * Tags a value as returned by {@link java.sql.ResultSet#getObject(int)}.
     * The SQLite driver returns the per-row storage class, so the mapping is
     * exact.
     */
    public static SqlValue of(Object raw) {
        if (raw == null)
            return NULL;
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte)
            return new SqlValue(Kind.INTEGER, ((Number) raw).longValue());
        if (raw instanceof Number)
            return new SqlValue(Kind.FLOAT, ((Number) raw).doubleValue());
        if (raw instanceof byte[])
            return new SqlValue(Kind.BLOB, raw);
        return new SqlValue(Kind.TEXT, raw.toString());
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean isNumeric() {
        return kind == Kind.INTEGER || kind == Kind.FLOAT;
    }

    public double asDouble() {
        return ((Number) value).doubleValue();
    }

    /** Display form used for uniqueness counting and sample rendering. */
    public String display() {
        return switch (kind) {
            case NULL -> "NULL";
            case BLOB -> "x'" + HexFormat.of().formatHex((byte[]) value) + "'";
            default -> value.toString();
        };
    }
}
