package de.bsommerfeld.scratchdb.agent.sync;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.scratchdb.core.config.ScratchDbConfig;
import de.bsommerfeld.scratchdb.core.domain.AgentIdentity;

import java.util.Set;

/** {@link ToolCatalog} backed by {@code scratchdb.tools.catalog}; the same for every agent. */
@Singleton
public class ConfiguredToolCatalog implements ToolCatalog {

    private final Set<String> toolIds;

    @Inject
    public ConfiguredToolCatalog(ScratchDbConfig config) {
        this.toolIds = Set.copyOf(config.getToolCatalog());
    }

    @Override
    public Set<String> availableToolIds(AgentIdentity agent) {
        return toolIds;
    }
}
