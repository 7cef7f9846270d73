package com.ratings.adapter.exception;

import com.ratings.engine.exception.ValidationException;
import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.stereotype.Component;

/**
 * Maps a failed run to the process exit code.
 */
@Component
public class RatingExitCodeMapper implements ExitCodeExceptionMapper {

    public static final int FAILURE = 1;
    public static final int FORMAT_ERROR = 2;
    public static final int VALIDATION_ERROR = 3;
    public static final int CONFIG_ERROR = 4;

    @Override
    public int getExitCode(Throwable exception) {
        // Runner failures arrive wrapped by Spring Boot
        for (Throwable t = exception; t != null; t = t.getCause()) {
            if (t instanceof FormatException) return FORMAT_ERROR;
            if (t instanceof ValidationException) return VALIDATION_ERROR;
            if (t instanceof ConfigException) return CONFIG_ERROR;
            if (t.getCause() == t) break;
        }
        return FAILURE;
    }
}
