package de.bsommerfeld.scratchdb.core.config;

import com.typesafe.config.Config;

public class BatchConfig {

    private long softSizeLimitBytes = 50L * 1024 * 1024;
    private int rowLimit = 1000;

    static BatchConfig from(Config c) {
        BatchConfig config = new BatchConfig();
        config.softSizeLimitBytes = c.getBytes("soft-size-limit-bytes");
        config.rowLimit = c.getInt("row-limit");
        return config;
    }

    /** File size above which every batch result carries a shrink warning. */
    public long getSoftSizeLimitBytes() {
        return softSizeLimitBytes;
    }

    public void setSoftSizeLimitBytes(long softSizeLimitBytes) {
        this.softSizeLimitBytes = softSizeLimitBytes;
    }

    /** Maximum rows returned per statement; extra rows mark the result truncated. */
    public int getRowLimit() {
        return rowLimit;
    }

    public void setRowLimit(int rowLimit) {
        this.rowLimit = rowLimit;
    }
}
