package com.filter.core.model;

/**
 * Outcome of a stage transition.
 *
 * @param storyId   the story moved
 * @param fromStage stage before the transition, {@code null} if the story had none
 * @param toStage   stage after the transition
 * @param changed   {@code false} when the story already was in {@code toStage}
 */
public record TransitionResult(String storyId, String fromStage, String toStage, boolean changed) {
}
