package de.bsommerfeld.scratchdb.agent.sync;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.scratchdb.core.domain.Skill;
import de.bsommerfeld.scratchdb.db.store.RecordStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read side of the skill library: the latest version of every skill, and the
 * prompt block that reminds the agent of its most recently touched skills.
 */
@Singleton
public class SkillPrompts {

    static final int DEFAULT_RECENT_LIMIT = 3;

    private final RecordStore store;

    @Inject
    public SkillPrompts(RecordStore store) {
        this.store = store;
    }

    /** Latest version per skill name, most recently updated first. */
    public List<Skill> latestVersions(String agentId) {
        Map<String, Skill> latest = new LinkedHashMap<>();
        for (Skill skill : store.findSkills(agentId)) {
            Skill known = latest.get(skill.name());
            if (known == null || skill.version() > known.version())
                latest.put(skill.name(), skill);
        }
        List<Skill> skills = new ArrayList<>(latest.values());
        skills.sort(Comparator.comparing((Skill s) -> s.updatedAt() == null ? Instant.EPOCH : s.updatedAt())
                .reversed()
                .thenComparing(Skill::name));
        return skills;
    }

    /** Tool ids referenced by any latest skill version, in first-seen order. */
    public Set<String> requiredToolIds(String agentId) {
        Set<String> toolIds = new LinkedHashSet<>();
        for (Skill skill : latestVersions(agentId))
            toolIds.addAll(skill.tools());
        return toolIds;
    }

    public String formatRecent(String agentId) {
        return formatRecent(agentId, DEFAULT_RECENT_LIMIT);
    }

    /**
     * @return the {@code limit} most recently updated skills rendered for the
     *         prompt, or an empty string if the agent has none
     */
    public String formatRecent(String agentId, int limit) {
        List<String> sections = new ArrayList<>();
        for (Skill skill : latestVersions(agentId)) {
            if (sections.size() >= limit)
                break;
            sections.add(format(skill));
        }
        return String.join("\n\n", sections);
    }

    static String format(Skill skill) {
        StringBuilder sb = new StringBuilder();
        sb.append("Skill: ").append(skill.name()).append(" (v").append(skill.version()).append(")\n");
        if (skill.description() != null && !skill.description().isBlank())
            sb.append("Description: ").append(skill.description().trim()).append('\n');
        if (!skill.tools().isEmpty())
            sb.append("Tools: ").append(String.join(", ", skill.tools())).append('\n');
        sb.append("Instructions:\n").append(skill.instructions() == null ? "" : skill.instructions().trim());
        return sb.toString();
    }
}
