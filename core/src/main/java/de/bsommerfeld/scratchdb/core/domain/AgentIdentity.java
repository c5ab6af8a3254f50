package de.bsommerfeld.scratchdb.core.domain;

import java.util.Objects;

/**
 * The agent a processing cycle runs for. {@code scopeId} groups agents that
 * may see each other's task cards (an organization, or a single user when the
 * agent has no organization).
 */
public record AgentIdentity(String agentId, String scopeId) {

    public AgentIdentity {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(scopeId, "scopeId");
    }
}
