package de.bsommerfeld.scratchdb.core.config;

import com.typesafe.config.Config;

public class StorageConfig {

    private long hardSizeLimitBytes = 100L * 1024 * 1024;
    private int compressionLevel = 3;
    private String keyPrefix = "agent_state";
    private String blobRoot = "";

    static StorageConfig from(Config c) {
        StorageConfig config = new StorageConfig();
        config.hardSizeLimitBytes = c.getBytes("hard-size-limit-bytes");
        config.compressionLevel = c.getInt("compression-level");
        config.keyPrefix = c.getString("key-prefix");
        config.blobRoot = c.getString("blob-root");
        return config;
    }

    /** Compacted file size above which the archive is wiped instead of written. */
    public long getHardSizeLimitBytes() {
        return hardSizeLimitBytes;
    }

    public void setHardSizeLimitBytes(long hardSizeLimitBytes) {
        this.hardSizeLimitBytes = hardSizeLimitBytes;
    }

    public int getCompressionLevel() {
        return compressionLevel;
    }

    public void setCompressionLevel(int compressionLevel) {
        this.compressionLevel = compressionLevel;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    /** Root directory of the file-system blob store. Blank selects the app data dir. */
    public String getBlobRoot() {
        return blobRoot;
    }

    public void setBlobRoot(String blobRoot) {
        this.blobRoot = blobRoot;
    }
}
