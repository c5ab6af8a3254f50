package de.bsommerfeld.scratchdb.db.store;

import com.google.inject.Singleton;
import de.bsommerfeld.scratchdb.core.domain.AgentSettings;
import de.bsommerfeld.scratchdb.core.domain.Skill;
import de.bsommerfeld.scratchdb.core.domain.TaskCard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory {@link RecordStore} for TEST mode: no disk I/O, no SQLite, no
 * schema. Bound by Guice when the application runs in
 * {@link de.bsommerfeld.scratchdb.core.config.ApplicationMode#TEST}.
 *
 * <p>
 * Transactions run against a copy of the state which replaces the live state
 * only when the work returns normally, so a throwing transaction leaves no
 * trace. All access is serialized on the instance.
 */
@Singleton
public class InMemoryRecordStore implements RecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryRecordStore.class);

    private static final Comparator<TaskCard> BOARD_ORDER = Comparator
            .comparingInt(TaskCard::priority).reversed()
            .thenComparing(TaskCard::createdAt)
            .thenComparing(TaskCard::id);

    private static final Comparator<Skill> SKILL_ORDER = Comparator
            .comparing(Skill::name)
            .thenComparingInt(Skill::version);

    private State state = new State();

    public InMemoryRecordStore() {
        LOG.warn("#########################################################");
        LOG.warn("#  TEST MODE ENABLED: Record persistence is DISABLED    #");
        LOG.warn("#########################################################");
    }

    @Override
    public synchronized List<TaskCard> findVisibleCards(String scopeId) {
        return state.cards(card -> scopeId.equals(state.scopes.get(card.id())));
    }

    @Override
    public synchronized List<TaskCard> findAssignedCards(String agentId) {
        return state.cards(card -> agentId.equals(card.assignedAgentId()));
    }

    @Override
    public synchronized List<Skill> findSkills(String agentId) {
        return state.skills.stream()
                .filter(skill -> agentId.equals(skill.agentId()))
                .sorted(SKILL_ORDER)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized AgentSettings findSettings(String agentId) {
        return state.settings.getOrDefault(agentId, AgentSettings.empty());
    }

    @Override
    public synchronized <T> T inTransaction(TransactionWork<T> work) {
        State working = state.copy();
        T result = work.run(working);
        state = working;
        return result;
    }

    /** Whole store content; a transaction works on its own copy. */
    private static final class State implements RecordTransaction {

        private final Map<String, TaskCard> cards = new LinkedHashMap<>();
        private final Map<String, String> scopes = new HashMap<>();
        private final List<Skill> skills = new ArrayList<>();
        private final Map<String, AgentSettings> settings = new HashMap<>();

        State copy() {
            State copy = new State();
            copy.cards.putAll(cards);
            copy.scopes.putAll(scopes);
            copy.skills.addAll(skills);
            copy.settings.putAll(settings);
            return copy;
        }

        List<TaskCard> cards(Predicate<TaskCard> filter) {
            return cards.values().stream()
                    .filter(filter)
                    .sorted(BOARD_ORDER)
                    .collect(Collectors.toList());
        }

        @Override
        public Optional<TaskCard> findOwnedCard(String agentId, String cardId) {
            TaskCard card = cards.get(cardId);
            if (card == null || !agentId.equals(card.assignedAgentId()))
                return Optional.empty();
            return Optional.of(card);
        }

        @Override
        public void insertCard(String scopeId, TaskCard card) {
            if (cards.containsKey(card.id()))
                throw new RecordStoreException("Duplicate card id " + card.id());
            cards.put(card.id(), card);
            scopes.put(card.id(), scopeId);
        }

        @Override
        public boolean updateCard(TaskCard card) {
            if (findOwnedCard(card.assignedAgentId(), card.id()).isEmpty())
                return false;
            cards.put(card.id(), card);
            return true;
        }

        @Override
        public boolean deleteCard(String agentId, String cardId) {
            if (findOwnedCard(agentId, cardId).isEmpty())
                return false;
            cards.remove(cardId);
            scopes.remove(cardId);
            return true;
        }

        @Override
        public Optional<Skill> findLatestSkill(String agentId, String name) {
            return skills.stream()
                    .filter(skill -> agentId.equals(skill.agentId()) && name.equals(skill.name()))
                    .max(Comparator.comparingInt(Skill::version).thenComparing(Skill::updatedAt));
        }

        @Override
        public void insertSkill(Skill skill) {
            for (Skill existing : skills) {
                if (existing.agentId().equals(skill.agentId()) && existing.name().equals(skill.name())
                        && existing.version() == skill.version())
                    throw new RecordStoreException("Duplicate skill version " + skill.name() + "@" + skill.version());
            }
            skills.add(skill);
        }

        @Override
        public int deleteSkills(String agentId, String name) {
            int before = skills.size();
            skills.removeIf(skill -> agentId.equals(skill.agentId()) && name.equals(skill.name()));
            return before - skills.size();
        }

        @Override
        public void saveSettings(String agentId, AgentSettings value) {
            settings.put(agentId, value);
        }
    }
}
