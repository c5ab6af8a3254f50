package de.bsommerfeld.scratchdb.agent.sync;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of reading a mirror table back. A row that cannot be parsed but
 * carries a usable id is <em>protected</em>: its durable record is neither
 * updated nor treated as removed.
 */
public final class RowParse<R> {

    private final Map<String, R> rows = new LinkedHashMap<>();
    private final Set<String> protectedIds = new HashSet<>();
    private final Set<String> protectedNames = new HashSet<>();
    private final List<String> errors = new ArrayList<>();

    public void accept(String id, R row) {
        rows.put(id, row);
    }

    /** Records a row that was skipped without an id to protect. */
    public void reject(String error) {
        errors.add(error);
    }

    /** Records a row that was skipped while keeping the durable record of {@code id} untouched. */
    public void protect(String id, String error) {
        protectedIds.add(id);
        errors.add(error);
    }

    /**
     * Keeps every record with this natural name (a skill name) from being
     * treated as removed.
     */
    public void protectName(String name) {
        protectedNames.add(name);
    }

    public Map<String, R> rows() {
        return Collections.unmodifiableMap(rows);
    }

    public Set<String> protectedIds() {
        return Collections.unmodifiableSet(protectedIds);
    }

    public Set<String> protectedNames() {
        return Collections.unmodifiableSet(protectedNames);
    }

    public List<String> errors() {
        return Collections.unmodifiableList(errors);
    }
}
