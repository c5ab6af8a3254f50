package de.bsommerfeld.scratchdb.core.domain;

/**
 * Agent-editable configuration: the free-text charter and an optional
 * schedule expression ({@code null} when the agent runs on demand only).
 */
public record AgentSettings(String charter, String schedule) {

    public static AgentSettings empty() {
        return new AgentSettings("", null);
    }
}
