package de.bsommerfeld.scratchdb.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running mode of the application. Selects the durable record store
 * implementation: SQLite-backed in {@link #PROD}, in-memory in {@link #TEST}.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the current mode from the system property {@code scratchdb.mode}
     * or the environment variable {@code SCRATCHDB_MODE}. Defaults to PROD if
     * neither is set or the value is unknown.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty("scratchdb.mode");
        if (mode == null || mode.isEmpty()) {
            mode = System.getenv("SCRATCHDB_MODE");
        }

        if (mode == null || mode.isEmpty()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}'. Defaulting to PROD.", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
