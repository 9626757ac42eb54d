package com.filter.core.kanban;

/**
 * What {@link KanbanStateMachine#currentStage} does when a story is linked from several stages.
 */
public enum ConflictPolicy {

    /**
     * Keep one link and delete the others: the journaled target of an interrupted transition
     * wins, otherwise the newest link, ties broken by the lexicographically smallest stage name.
     */
    REPAIR,

    /**
     * Throw {@link com.filter.core.error.StateConflictException} unless the duplicate is the
     * journaled leftover of an interrupted transition.
     */
    FAIL
}
