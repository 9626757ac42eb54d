package com.filter.core.model;

/**
 * A recoverable corruption found while listing the board.
 *
 * @param stage      stage directory the problem was found in
 * @param entry      directory entry name, usually a story id
 * @param kind       what is wrong
 * @param detail     human-readable description
 * @param suggestion how to repair it
 */
public record ListingProblem(String stage, String entry, Kind kind, String detail, String suggestion) {

    public enum Kind {
        DANGLING_LINK,
        NOT_A_LINK,
        UNREADABLE_STORY,
        DUPLICATE_STAGE
    }
}
