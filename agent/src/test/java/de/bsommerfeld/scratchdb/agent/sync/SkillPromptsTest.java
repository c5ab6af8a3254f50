package de.bsommerfeld.scratchdb.agent.sync;

import de.bsommerfeld.scratchdb.core.domain.Skill;
import de.bsommerfeld.scratchdb.db.store.RecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SkillPromptsTest {

    @Mock
    RecordStore store;

    private SkillPrompts prompts;

    @BeforeEach
    void setUp() {
        prompts = new SkillPrompts(store);
    }

    private static Skill skill(String name, int version, String updatedAt, List<String> tools) {
        Instant at = Instant.parse(updatedAt);
        return new Skill(name + version, "agent-a", name, "About " + name, version, tools,
                "Do " + name + " v" + version, at, at);
    }

    @Test
    void latestVersions_shouldKeepHighestVersionPerName_newestFirst() {
        when(store.findSkills("agent-a")).thenReturn(List.of(
                skill("plan", 1, "2026-01-01T00:00:00Z", List.of()),
                skill("plan", 2, "2026-01-05T00:00:00Z", List.of()),
                skill("summarize", 1, "2026-01-03T00:00:00Z", List.of())));

        List<Skill> latest = prompts.latestVersions("agent-a");

        assertEquals(2, latest.size());
        assertEquals("plan", latest.get(0).name());
        assertEquals(2, latest.get(0).version());
        assertEquals("summarize", latest.get(1).name());
    }

    @Test
    void requiredToolIds_shouldUnionToolsOfLatestVersionsOnly() {
        when(store.findSkills("agent-a")).thenReturn(List.of(
                skill("plan", 1, "2026-01-01T00:00:00Z", List.of("shell_exec")),
                skill("plan", 2, "2026-01-05T00:00:00Z", List.of("web_search")),
                skill("summarize", 1, "2026-01-03T00:00:00Z", List.of("web_search", "sql_query"))));

        assertEquals(Set.of("web_search", "sql_query"), prompts.requiredToolIds("agent-a"));
    }

    @Test
    void formatRecent_shouldRenderUpToLimit() {
        when(store.findSkills("agent-a")).thenReturn(List.of(
                skill("plan", 1, "2026-01-05T00:00:00Z", List.of("web_search")),
                skill("summarize", 1, "2026-01-03T00:00:00Z", List.of()),
                skill("triage", 1, "2026-01-01T00:00:00Z", List.of())));

        String text = prompts.formatRecent("agent-a", 2);

        assertEquals("Skill: plan (v1)\nDescription: About plan\nTools: web_search\nInstructions:\nDo plan v1"
                + "\n\n"
                + "Skill: summarize (v1)\nDescription: About summarize\nInstructions:\nDo summarize v1", text);
    }

    @Test
    void formatRecent_shouldBeEmpty_whenNoSkills() {
        when(store.findSkills("agent-a")).thenReturn(List.of());
        assertEquals("", prompts.formatRecent("agent-a"));
    }
}
