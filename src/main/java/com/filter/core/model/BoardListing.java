package com.filter.core.model;

import java.util.List;

/**
 * The whole board in configured stage order, plus stories without a stage.
 */
public record BoardListing(List<StageListing> stages, List<Story> unstarted, List<ListingProblem> problems) {

    public BoardListing {
        stages = List.copyOf(stages);
        unstarted = List.copyOf(unstarted);
        problems = List.copyOf(problems);
    }

    public int storyCount() {
        return stages.stream().mapToInt(s -> s.stories().size()).sum() + unstarted.size();
    }
}
