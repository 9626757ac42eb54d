package com.filter.core.error;

public class StoryNotFoundException extends ValidationException {

    private final String storyId;

    public StoryNotFoundException(String storyId) {
        super("Story " + storyId + " not found", "Run 'filter story list' to see existing stories");
        this.storyId = storyId;
    }

    public String storyId() {
        return storyId;
    }
}
