package de.bsommerfeld.scratchdb.db.guard;

import java.util.Optional;

/**
 * Deny-lists applied to every statement a {@link GuardedSession} prepares.
 *
 * <p>
 * Names are compared lower-case. Implementations hold data only; the
 * token-level enforcement lives in {@link StatementAuthorizer}.
 */
public interface SandboxPolicy {

    /** Statement-level actions such as {@code attach}. */
    boolean isActionBlocked(String action);

    /** Built-in or extension functions that must never be called. */
    boolean isFunctionBlocked(String function);

    /** Pragmas that may neither be read nor written. */
    boolean isPragmaBlocked(String pragma);

    /**
     * Lexical shape check on comment- and literal-stripped text.
     *
     * @param maskedSql output of {@link SqlLexer#mask(String)}
     * @return the block reason, or empty when the shape is allowed
     */
    Optional<String> blockedShape(String maskedSql);
}
