package de.bsommerfeld.scratchdb.agent.sync;

import java.util.Optional;

/**
 * Base for domains whose rows map one-to-one onto durable records. Routes
 * every created, changed and removed row through the ownership rules and
 * then to the domain's hooks:
 * <ul>
 * <li>created: {@link #validateCreate}, then the row must be owned by the
 * executing agent, then {@link #create}</li>
 * <li>changed: the baseline row must be owned by the agent and the
 * ownership field must not change, then {@link #update}</li>
 * <li>removed: the baseline row must be owned by the agent, then
 * {@link #remove}</li>
 * </ul>
 */
public abstract class RowwiseMirrorDomain<D, R> implements MirrorDomain<D, R> {

    /** Capitalized label used in error messages, e.g. {@code Kanban}. */
    protected abstract String label();

    /** Plural noun used in ownership errors, e.g. {@code tasks}. */
    protected abstract String recordNoun();

    protected abstract boolean isOwnedBy(R row, String agentId);

    /** Name of the ownership column, quoted in ownership-change errors. */
    protected abstract String ownerField();

    /** @return an error message if the row must not be created */
    protected Optional<String> validateCreate(R row, MirrorDiff<R> diff, ApplyContext ctx) {
        return Optional.empty();
    }

    protected abstract void create(R row, ApplyContext ctx);

    protected abstract void update(R before, R after, ApplyContext ctx);

    protected abstract void remove(R row, ApplyContext ctx);

    @Override
    public void apply(MirrorDiff<R> diff, ApplyContext ctx) {
        String agentId = ctx.agentId();

        for (R row : diff.created()) {
            Optional<String> invalid = validateCreate(row, diff, ctx);
            if (invalid.isPresent()) {
                ctx.error(invalid.get());
                continue;
            }
            if (!isOwnedBy(row, agentId)) {
                ctx.error(String.format("%s create denied for %s: only %s assigned to this agent may be created.",
                        label(), idOf(row), recordNoun()));
                continue;
            }
            create(row, ctx);
        }

        for (MirrorDiff.Changed<R> change : diff.changed()) {
            if (!isOwnedBy(change.before(), agentId)) {
                ctx.error(String.format("%s update denied for %s: only %s assigned to this agent may be updated.",
                        label(), change.id(), recordNoun()));
                continue;
            }
            if (!isOwnedBy(change.after(), agentId)) {
                ctx.error(String.format("%s update denied for %s: %s cannot be changed by the agent.",
                        label(), change.id(), ownerField()));
                continue;
            }
            update(change.before(), change.after(), ctx);
        }

        for (R row : diff.removed()) {
            if (!isOwnedBy(row, agentId)) {
                ctx.error(String.format("%s removal denied for %s: only %s assigned to this agent may be removed.",
                        label(), idOf(row), recordNoun()));
                continue;
            }
            remove(row, ctx);
        }
    }
}
