package com.filter.core.model;

import java.util.List;

/**
 * Stories resolved from one stage directory, with the problems met along the way.
 */
public record StageListing(String stage, List<Story> stories, List<ListingProblem> problems) {

    public StageListing {
        stories = List.copyOf(stories);
        problems = List.copyOf(problems);
    }
}
