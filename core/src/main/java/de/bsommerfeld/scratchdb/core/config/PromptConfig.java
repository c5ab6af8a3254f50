package de.bsommerfeld.scratchdb.core.config;

import com.typesafe.config.Config;

/**
 * Size bounds for everything rendered into the agent's prompt: the schema
 * summary, the digest and the tool-result cache rows.
 */
public class PromptConfig {

    private int schemaMaxBytes = 30_000;
    private int schemaMaxTables = 25;
    private int schemaMaxCreateChars = 600;
    private int digestSampleSize = 1000;
    private int digestMaxTables = 20;
    private int digestMaxColumns = 50;
    private int toolResultMaxBytes = 5_000_000;

    static PromptConfig from(Config c) {
        PromptConfig config = new PromptConfig();
        config.schemaMaxBytes = c.getInt("schema-max-bytes");
        config.schemaMaxTables = c.getInt("schema-max-tables");
        config.schemaMaxCreateChars = c.getInt("schema-max-create-chars");
        config.digestSampleSize = c.getInt("digest-sample-size");
        config.digestMaxTables = c.getInt("digest-max-tables");
        config.digestMaxColumns = c.getInt("digest-max-columns");
        config.toolResultMaxBytes = c.getInt("tool-result-max-bytes");
        return config;
    }

    public int getSchemaMaxBytes() {
        return schemaMaxBytes;
    }

    public void setSchemaMaxBytes(int schemaMaxBytes) {
        this.schemaMaxBytes = schemaMaxBytes;
    }

    public int getSchemaMaxTables() {
        return schemaMaxTables;
    }

    public void setSchemaMaxTables(int schemaMaxTables) {
        this.schemaMaxTables = schemaMaxTables;
    }

    public int getSchemaMaxCreateChars() {
        return schemaMaxCreateChars;
    }

    public void setSchemaMaxCreateChars(int schemaMaxCreateChars) {
        this.schemaMaxCreateChars = schemaMaxCreateChars;
    }

    public int getDigestSampleSize() {
        return digestSampleSize;
    }

    public void setDigestSampleSize(int digestSampleSize) {
        this.digestSampleSize = digestSampleSize;
    }

    public int getDigestMaxTables() {
        return digestMaxTables;
    }

    public void setDigestMaxTables(int digestMaxTables) {
        this.digestMaxTables = digestMaxTables;
    }

    public int getDigestMaxColumns() {
        return digestMaxColumns;
    }

    public void setDigestMaxColumns(int digestMaxColumns) {
        this.digestMaxColumns = digestMaxColumns;
    }

    public int getToolResultMaxBytes() {
        return toolResultMaxBytes;
    }

    public void setToolResultMaxBytes(int toolResultMaxBytes) {
        this.toolResultMaxBytes = toolResultMaxBytes;
    }
}
