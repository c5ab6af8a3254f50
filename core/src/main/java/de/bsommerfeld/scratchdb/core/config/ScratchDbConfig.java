package de.bsommerfeld.scratchdb.core.config;

import com.typesafe.config.Config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object. Each section maps one block of
 * {@code reference.conf}; field defaults mirror the shipped defaults so a
 * {@code new ScratchDbConfig()} is usable without any file.
 */
public class ScratchDbConfig {

    private SessionConfig session = new SessionConfig();
    private BatchConfig batch = new BatchConfig();
    private StorageConfig storage = new StorageConfig();
    private PromptConfig prompt = new PromptConfig();
    private List<String> toolCatalog = new ArrayList<>();

    static ScratchDbConfig from(Config c) {
        ScratchDbConfig config = new ScratchDbConfig();
        config.session = SessionConfig.from(c.getConfig("session"));
        config.batch = BatchConfig.from(c.getConfig("batch"));
        config.storage = StorageConfig.from(c.getConfig("storage"));
        config.prompt = PromptConfig.from(c.getConfig("prompt"));
        config.toolCatalog = new ArrayList<>(c.getStringList("tools.catalog"));
        return config;
    }

    public SessionConfig getSession() {
        return session;
    }

    public BatchConfig getBatch() {
        return batch;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public PromptConfig getPrompt() {
        return prompt;
    }

    public List<String> getToolCatalog() {
        return toolCatalog;
    }

    public void setToolCatalog(List<String> toolCatalog) {
        this.toolCatalog = new ArrayList<>(toolCatalog);
    }
}
