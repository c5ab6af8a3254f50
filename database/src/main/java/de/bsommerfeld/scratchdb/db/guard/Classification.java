package de.bsommerfeld.scratchdb.db.guard;

/**
 * Outcome of {@link StatementClassifier#classify(String)}.
 *
 * @param kind   write, read or blocked
 * @param reason block reason, {@code null} unless {@code kind} is BLOCKED
 */
public record Classification(Kind kind, String reason) {

    public enum Kind {
        /** Mutates state and returns no rows. */
        WRITE,
        /** Anything that may return rows or could not be classified. */
        READ,
        BLOCKED
    }

    private static final Classification WRITE = new Classification(Kind.WRITE, null);
    private static final Classification READ = new Classification(Kind.READ, null);

    public static Classification write() {
        return WRITE;
    }

    public static Classification read() {
        return READ;
    }

    public static Classification blocked(String reason) {
        return new Classification(Kind.BLOCKED, reason);
    }

    public boolean isWrite() {
        return kind == Kind.WRITE;
    }

    public boolean isBlocked() {
        return kind == Kind.BLOCKED;
    }
}
