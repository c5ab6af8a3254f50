package de.bsommerfeld.scratchdb.core.config;

import com.typesafe.config.Config;

import java.time.Duration;

public class SessionConfig {

    private Duration queryTimeout = Duration.ofSeconds(30);
    private int progressInterval = 10_000;

    static SessionConfig from(Config c) {
        SessionConfig config = new SessionConfig();
        config.queryTimeout = c.getDuration("query-timeout");
        config.progressInterval = c.getInt("progress-interval");
        return config;
    }

    /** Wall-clock budget per statement, re-armed for every statement. */
    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public void setQueryTimeout(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    /** Number of engine VM steps between two deadline checks. */
    public int getProgressInterval() {
        return progressInterval;
    }

    public void setProgressInterval(int progressInterval) {
        this.progressInterval = progressInterval;
    }
}
