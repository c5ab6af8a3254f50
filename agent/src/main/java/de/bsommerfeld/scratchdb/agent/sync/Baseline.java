package de.bsommerfeld.scratchdb.agent.sync;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mirror rows as seeded, keyed by record id in seed order. Captured once per
 * cycle and compared against the table after the agent ran.
 */
public final class Baseline<R> {

    private final Map<String, R> rows;

    Baseline(Map<String, R> rows) {
        this.rows = Collections.unmodifiableMap(new LinkedHashMap<>(rows));
    }

    public Map<String, R> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }
}
