package com.ratings.adapter.format;

import com.ratings.engine.model.RatingList;

import java.nio.file.Path;
import java.util.Set;

/**
 * Reads a prior rating list into the canonical model.
 */
public interface RatingListReader {

    /**
     * Lower-case file extensions handled, without the dot.
     */
    Set<String> extensions();

    RatingList read(Path file);
}
