package de.bsommerfeld.scratchdb.agent.sync;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Difference between a {@link Baseline} and the rows read back from the
 * mirror. Created rows keep table order; changed and removed rows are
 * ordered by id. Protected ids appear in none of the three lists.
 */
public final class MirrorDiff<R> {

    /** A shared row whose field tuple differs from its baseline. */
    public record Changed<T>(String id, T before, T after) {
    }

    private final Map<String, R> baseline;
    private final Map<String, R> current;
    private final Set<String> protectedIds;
    private final Set<String> protectedNames;
    private final List<R> created = new ArrayList<>();
    private final List<Changed<R>> changed = new ArrayList<>();
    private final List<R> removed = new ArrayList<>();

    MirrorDiff(Baseline<R> baseline, RowParse<R> current) {
        this.baseline = baseline.rows();
        this.current = current.rows();
        this.protectedIds = current.protectedIds();
        this.protectedNames = current.protectedNames();

        for (Map.Entry<String, R> entry : this.current.entrySet()) {
            if (!this.baseline.containsKey(entry.getKey()))
                created.add(entry.getValue());
        }
        for (String id : new TreeSet<>(this.current.keySet())) {
            R before = this.baseline.get(id);
            R after = this.current.get(id);
            if (before != null && !Objects.equals(before, after))
                changed.add(new Changed<>(id, before, after));
        }
        for (String id : new TreeSet<>(this.baseline.keySet())) {
            if (!this.current.containsKey(id) && !protectedIds.contains(id))
                removed.add(this.baseline.get(id));
        }
    }

    public List<R> created() {
        return Collections.unmodifiableList(created);
    }

    public List<Changed<R>> changed() {
        return Collections.unmodifiableList(changed);
    }

    public List<R> removed() {
        return Collections.unmodifiableList(removed);
    }

    public Map<String, R> baseline() {
        return baseline;
    }

    public Map<String, R> current() {
        return current;
    }

    public Set<String> protectedIds() {
        return protectedIds;
    }

    public Set<String> protectedNames() {
        return protectedNames;
    }

    /**
     * Whether nothing changed. Domains that diff by name rather than id
     * treat a pure reordering the same way.
     */
    public boolean isEmpty() {
        return created.isEmpty() && changed.isEmpty() && removed.isEmpty();
    }
}
