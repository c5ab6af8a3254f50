package de.bsommerfeld.scratchdb.agent.sync;

import de.bsommerfeld.scratchdb.core.domain.TaskCard;
import de.bsommerfeld.scratchdb.core.domain.TaskStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Board state after a reconcile changed something: counts per status plus
 * the first few titles of each column in board order.
 */
public record TaskBoardSnapshot(
        int todoCount,
        int doingCount,
        int doneCount,
        List<String> todoTitles,
        List<String> doingTitles,
        List<String> doneTitles) {

    static final int MAX_TITLES = 5;

    public TaskBoardSnapshot {
        todoTitles = List.copyOf(todoTitles);
        doingTitles = List.copyOf(doingTitles);
        doneTitles = List.copyOf(doneTitles);
    }

    /** @param cards cards in board order */
    public static TaskBoardSnapshot of(List<TaskCard> cards) {
        List<String> todo = new ArrayList<>();
        List<String> doing = new ArrayList<>();
        List<String> done = new ArrayList<>();
        for (TaskCard card : cards) {
            switch (card.status()) {
                case TODO -> todo.add(card.title());
                case DOING -> doing.add(card.title());
                case DONE -> done.add(card.title());
            }
        }
        return new TaskBoardSnapshot(todo.size(), doing.size(), done.size(),
                head(todo), head(doing), head(done));
    }

    private static List<String> head(List<String> titles) {
        return titles.subList(0, Math.min(MAX_TITLES, titles.size()));
    }

    public int count(TaskStatus status) {
        return switch (status) {
            case TODO -> todoCount;
            case DOING -> doingCount;
            case DONE -> doneCount;
        };
    }
}
