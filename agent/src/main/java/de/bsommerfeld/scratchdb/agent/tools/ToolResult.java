package de.bsommerfeld.scratchdb.agent.tools;

import java.time.Instant;
import java.util.Objects;

/** Raw output of one tool call, keyed by the step that produced it. */
public record ToolResult(String resultId, String toolName, Instant createdAt, String text) {

    public ToolResult {
        Objects.requireNonNull(resultId, "resultId");
        Objects.requireNonNull(toolName, "toolName");
    }
}
