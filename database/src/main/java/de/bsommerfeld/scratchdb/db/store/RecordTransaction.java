package de.bsommerfeld.scratchdb.db.store;

import de.bsommerfeld.scratchdb.core.domain.AgentSettings;
import de.bsommerfeld.scratchdb.core.domain.Skill;
import de.bsommerfeld.scratchdb.core.domain.TaskCard;

import java.util.Optional;

/**
 * Mutations available inside {@link RecordStore#inTransaction}. Card writes
 * are always scoped to the assigned agent: an id owned by someone else
 * behaves like a missing id.
 */
public interface RecordTransaction {

    Optional<TaskCard> findOwnedCard(String agentId, String cardId);

    void insertCard(String scopeId, TaskCard card);

    /** @return {@code false} if no card with that id is assigned to the card's agent */
    boolean updateCard(TaskCard card);

    /** @return {@code false} if no card with that id is assigned to the agent */
    boolean deleteCard(String agentId, String cardId);

    /** Highest version of the named skill, ties broken by the latest update. */
    Optional<Skill> findLatestSkill(String agentId, String name);

    void insertSkill(Skill skill);

    /** Deletes every version of the named skill and returns how many were removed. */
    int deleteSkills(String agentId, String name);

    void saveSettings(String agentId, AgentSettings settings);
}
