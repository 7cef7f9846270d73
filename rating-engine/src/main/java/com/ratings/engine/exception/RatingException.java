package com.ratings.engine.exception;

/**
 * Base class for every failure that aborts a rating run.
 */
public class RatingException extends RuntimeException {

    public RatingException(String message) {
        super(message);
    }

    public RatingException(String message, Throwable cause) {
        super(message, cause);
    }
}
