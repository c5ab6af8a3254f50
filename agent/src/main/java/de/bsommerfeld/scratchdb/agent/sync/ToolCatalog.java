package de.bsommerfeld.scratchdb.agent.sync;

import de.bsommerfeld.scratchdb.core.domain.AgentIdentity;

import java.util.Set;

/**
 * Canonical tool ids an agent can resolve. Skills may only reference ids
 * from this set.
 */
public interface ToolCatalog {

    Set<String> availableToolIds(AgentIdentity agent);
}
