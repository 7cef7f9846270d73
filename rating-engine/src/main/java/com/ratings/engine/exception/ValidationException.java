package com.ratings.engine.exception;

import java.util.List;

/**
 * Thrown when the players and games of a tournament are inconsistent.
 * Carries every problem found, not just the first one.
 */
public class ValidationException extends RatingException {

    private final List<String> problems;

    public ValidationException(List<String> problems) {
        super(buildMessage(problems));
        this.problems = List.copyOf(problems);
    }

    public ValidationException(String problem) {
        this(List.of(problem));
    }

    public List<String> getProblems() {
        return problems;
    }

    private static String buildMessage(List<String> problems) {
        if (problems.size() == 1) {
            return "Invalid tournament data: " + problems.get(0);
        }
        return String.format("Invalid tournament data (%d problems):%n  - %s",
                problems.size(), String.join(System.lineSeparator() + "  - ", problems));
    }
}
