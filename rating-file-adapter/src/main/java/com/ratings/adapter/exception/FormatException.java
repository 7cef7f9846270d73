package com.ratings.adapter.exception;

import com.ratings.engine.exception.RatingException;

import java.nio.file.Path;

/**
 * Thrown when an input file is malformed or its format is not recognised.
 */
public class FormatException extends RatingException {

    private final Integer line;

    public FormatException(String message, String source, Integer line) {
        super(buildMessage(message, source, line));
        this.line = line;
    }

    public FormatException(String message, Path file) {
        this(message, String.valueOf(file), null);
    }

    public Integer getLine() {
        return line;
    }

    private static String buildMessage(String message, String source, Integer line) {
        if (line != null) {
            return String.format("%s:%d: %s", source, line, message);
        }
        return String.format("%s: %s", source, message);
    }
}
