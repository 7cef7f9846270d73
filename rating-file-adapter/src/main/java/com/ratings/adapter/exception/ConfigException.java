package com.ratings.adapter.exception;

import com.ratings.engine.exception.RatingException;
import org.springframework.boot.ExitCodeGenerator;

/**
 * Thrown when a required command-line option or setting is missing or invalid.
 * Carries its own exit code for failures raised while the context is still starting.
 */
public class ConfigException extends RatingException implements ExitCodeGenerator {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return RatingExitCodeMapper.CONFIG_ERROR;
    }
}
